package com.shellysvn.dispatch.cli;

import com.shellysvn.core.client.SvnClient;
import com.shellysvn.core.config.ShellyProperties;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: shelly-engine svn log [--limit N] [--start-revision R] [--end-revision R] [path]
 * <p>
 * Entries are printed newest first.
 */
@Command(name = "log", mixinStandardHelpOptions = true, description = "Get commit history")
@Component
public class LogCommand extends SvnSubcommand {

    @Parameters(index = "0", arity = "0..1", description = "Working copy path or URL (default: current directory)")
    private String path;

    @Option(names = {"--limit", "-l"}, description = "Maximum number of entries (default: shelly.svn.log-limit)")
    private Integer limit;

    @Option(names = "--start-revision", description = "First revision of the range")
    private Long startRevision;

    @Option(names = "--end-revision", description = "Last revision of the range (default: HEAD)")
    private Long endRevision;

    private final ShellyProperties properties;

    public LogCommand(SvnClient client, ShellyProperties properties) {
        super(client);
        this.properties = properties;
    }

    @Override
    protected Object execute() {
        int effectiveLimit = limit != null ? limit : properties.getLogLimit();
        if (effectiveLimit <= 0) {
            throw new IllegalArgumentException("--limit must be positive");
        }
        return client.log(path != null ? path : currentDirectory(), effectiveLimit, startRevision, endRevision);
    }
}
