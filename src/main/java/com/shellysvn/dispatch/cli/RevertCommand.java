package com.shellysvn.dispatch.cli;

import com.shellysvn.core.client.SvnClient;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * CLI command: shelly-engine svn revert [paths...]
 */
@Command(name = "revert", mixinStandardHelpOptions = true, description = "Revert local changes")
@Component
public class RevertCommand extends SvnSubcommand {

    @Parameters(arity = "0..*", description = "Paths to revert (default: current directory)")
    private List<String> paths = new ArrayList<>();

    public RevertCommand(SvnClient client) {
        super(client);
    }

    @Override
    protected Object execute() {
        var targets = paths.isEmpty() ? List.of(currentDirectory()) : paths;
        client.revert(targets);
        return Map.of("success", true);
    }
}
