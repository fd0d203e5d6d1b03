package com.shellysvn.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for the engine.
 * Routes to the {@code svn} command group.
 */
@Command(
        name = "shelly-engine",
        mixinStandardHelpOptions = true,
        version = "ShellySVN Engine 0.1.0",
        description = "Runs svn and reports its results as JSON",
        subcommands = {
                SvnCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ShellyCommand implements Runnable {

    @Override
    public void run() {
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
