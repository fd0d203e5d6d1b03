package com.shellysvn.dispatch.cli;

import com.shellysvn.core.client.SvnClient;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;

/**
 * CLI command: shelly-engine svn commit --message MSG [paths...]
 */
@Command(name = "commit", mixinStandardHelpOptions = true, description = "Commit changes (--message required)")
@Component
public class CommitCommand extends SvnSubcommand {

    @Option(names = {"--message", "-m"}, description = "Commit message")
    private String message;

    @Parameters(arity = "0..*", description = "Paths to commit (default: current directory)")
    private List<String> paths = new ArrayList<>();

    public CommitCommand(SvnClient client) {
        super(client);
    }

    @Override
    protected Object execute() {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("Commit message is required (--message)");
        }
        return client.commit(paths.isEmpty() ? List.of(currentDirectory()) : paths, message);
    }
}
