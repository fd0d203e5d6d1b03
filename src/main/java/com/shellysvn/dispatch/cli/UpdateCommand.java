package com.shellysvn.dispatch.cli;

import com.shellysvn.core.client.SvnClient;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: shelly-engine svn update [path]
 */
@Command(name = "update", mixinStandardHelpOptions = true, description = "Update working copy")
@Component
public class UpdateCommand extends SvnSubcommand {

    @Parameters(index = "0", arity = "0..1", description = "Working copy path (default: current directory)")
    private String path;

    public UpdateCommand(SvnClient client) {
        super(client);
    }

    @Override
    protected Object execute() {
        return client.update(path != null ? path : currentDirectory());
    }
}
