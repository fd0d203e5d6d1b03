package com.shellysvn.dispatch.cli;

import com.shellysvn.core.client.SvnClient;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.Map;

/**
 * CLI command: shelly-engine svn cleanup [path]
 */
@Command(name = "cleanup", mixinStandardHelpOptions = true, description = "Cleanup working copy")
@Component
public class CleanupCommand extends SvnSubcommand {

    @Parameters(index = "0", arity = "0..1", description = "Working copy path (default: current directory)")
    private String path;

    public CleanupCommand(SvnClient client) {
        super(client);
    }

    @Override
    protected Object execute() {
        client.cleanup(path != null ? path : currentDirectory());
        return Map.of("success", true);
    }
}
