package com.shellysvn.dispatch.cli;

import com.shellysvn.core.client.SvnClient;
import com.shellysvn.core.client.SvnClient.Depth;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.Locale;

/**
 * CLI command: shelly-engine svn list [-r REV] [--depth D] url
 */
@Command(name = "list", mixinStandardHelpOptions = true, description = "List repository entries")
@Component
public class ListCommand extends SvnSubcommand {

    @Parameters(index = "0", description = "Repository URL or working copy path")
    private String url;

    @Option(names = {"--revision", "-r"}, description = "Revision to list (default: HEAD)")
    private String revision;

    @Option(names = "--depth", description = "Listing depth: ${COMPLETION-CANDIDATES}",
            converter = DepthConverter.class)
    private Depth depth;

    public ListCommand(SvnClient client) {
        super(client);
    }

    @Override
    protected Object execute() {
        return client.list(url, revision, depth);
    }

    static class DepthConverter implements ITypeConverter<Depth> {
        @Override
        public Depth convert(String value) {
            return Depth.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }
}
