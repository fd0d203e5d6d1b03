package com.shellysvn.dispatch.cli;

import com.shellysvn.core.client.SvnClient;
import com.shellysvn.core.exec.SvnCommandException;
import com.shellysvn.core.parse.SvnParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Option;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Shared error handling for the {@code svn} subcommands.
 *
 * <p>Subclasses return the value to print; failures become a JSON error object
 * on stderr. svn failures exit with 1, unparseable reports with 2.
 */
public abstract class SvnSubcommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SvnSubcommand.class);

    static final int EXIT_PARSE_ERROR = 2;

    /**
     * Accepted so scripts written for earlier releases, which required
     * {@code --json}, keep working. Output is JSON either way.
     */
    @Option(names = "--json", hidden = true, description = "No-op: output is always JSON")
    @SuppressWarnings("unused")
    private boolean json;

    protected final SvnClient client;

    protected SvnSubcommand(SvnClient client) {
        this.client = client;
    }

    /**
     * @return the result to print as JSON
     */
    protected abstract Object execute();

    @Override
    public Integer call() {
        try {
            JsonOutput.result(execute());
            return CommandLine.ExitCode.OK;
        } catch (SvnCommandException e) {
            JsonOutput.error(e.getMessage(), Map.of(
                    "exitCode", e.getExitCode(),
                    "kind", e.getFailureKind().name()));
            return CommandLine.ExitCode.SOFTWARE;
        } catch (SvnParseException e) {
            log.debug("Unparseable svn report:\n{}", e.getRawInput());
            JsonOutput.error(e.getMessage());
            return EXIT_PARSE_ERROR;
        } catch (IllegalArgumentException e) {
            JsonOutput.error(e.getMessage());
            return CommandLine.ExitCode.SOFTWARE;
        }
    }

    static String currentDirectory() {
        return System.getProperty("user.dir");
    }
}
