package com.shellysvn.dispatch.cli;

import com.shellysvn.core.client.SvnClient;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: shelly-engine svn status [path]
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Get SVN status of a working copy")
@Component
public class StatusCommand extends SvnSubcommand {

    @Parameters(index = "0", arity = "0..1", description = "Working copy path (default: current directory)")
    private String path;

    public StatusCommand(SvnClient client) {
        super(client);
    }

    @Override
    protected Object execute() {
        return client.status(path != null ? path : currentDirectory());
    }
}
