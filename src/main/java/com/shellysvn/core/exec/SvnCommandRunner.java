package com.shellysvn.core.exec;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs the svn client with the given arguments and returns what it printed.
 */
@FunctionalInterface
public interface SvnCommandRunner {

    /**
     * @param args       svn arguments, without the executable
     * @param workingDir directory to run in, or null for the current directory
     * @return captured standard output
     * @throws SvnCommandException when svn cannot be started or exits non-zero
     */
    String run(List<String> args, Path workingDir);
}
