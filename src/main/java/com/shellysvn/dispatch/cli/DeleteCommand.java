package com.shellysvn.dispatch.cli;

import com.shellysvn.core.client.SvnClient;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * CLI command: shelly-engine svn delete [paths...]
 */
@Command(name = "delete", mixinStandardHelpOptions = true, description = "Delete files from version control")
@Component
public class DeleteCommand extends SvnSubcommand {

    @Parameters(arity = "0..*", description = "Paths to delete")
    private List<String> paths = new ArrayList<>();

    public DeleteCommand(SvnClient client) {
        super(client);
    }

    @Override
    protected Object execute() {
        if (paths.isEmpty()) {
            throw new IllegalArgumentException("No paths specified for delete");
        }
        client.delete(paths);
        return Map.of("success", true);
    }
}
