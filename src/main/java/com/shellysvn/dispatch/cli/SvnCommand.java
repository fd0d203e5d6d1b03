package com.shellysvn.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * CLI command group: shelly-engine svn &lt;subcommand&gt;
 */
@Command(
        name = "svn",
        mixinStandardHelpOptions = true,
        description = "Subversion operations",
        subcommands = {
                StatusCommand.class,
                LogCommand.class,
                InfoCommand.class,
                ListCommand.class,
                UpdateCommand.class,
                CommitCommand.class,
                RevertCommand.class,
                AddCommand.class,
                DeleteCommand.class,
                CleanupCommand.class
        }
)
@Component
public class SvnCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        JsonOutput.error("No SVN subcommand provided");
        spec.commandLine().usage(System.err);
        return CommandLine.ExitCode.USAGE;
    }
}
