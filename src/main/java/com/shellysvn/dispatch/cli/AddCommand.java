package com.shellysvn.dispatch.cli;

import com.shellysvn.core.client.SvnClient;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * CLI command: shelly-engine svn add [paths...]
 */
@Command(name = "add", mixinStandardHelpOptions = true, description = "Add files to version control")
@Component
public class AddCommand extends SvnSubcommand {

    @Parameters(arity = "0..*", description = "Paths to add")
    private List<String> paths = new ArrayList<>();

    public AddCommand(SvnClient client) {
        super(client);
    }

    @Override
    protected Object execute() {
        if (paths.isEmpty()) {
            throw new IllegalArgumentException("No paths specified for add");
        }
        client.add(paths);
        return Map.of("success", true);
    }
}
