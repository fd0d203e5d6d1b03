package com.shellysvn.dispatch.cli;

import com.shellysvn.core.client.SvnClient;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: shelly-engine svn info [path-or-url]
 */
@Command(name = "info", mixinStandardHelpOptions = true, description = "Get working copy information")
@Component
public class InfoCommand extends SvnSubcommand {

    @Parameters(index = "0", arity = "0..1", description = "Working copy path or URL (default: current directory)")
    private String target;

    public InfoCommand(SvnClient client) {
        super(client);
    }

    @Override
    protected Object execute() {
        return client.info(target != null ? target : currentDirectory());
    }
}
