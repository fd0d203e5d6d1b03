package com.shellysvn.core.logging;

import org.slf4j.MDC;

import java.nio.file.Path;

/**
 * Utility for managing engine-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setCommand(String subcommand, Path workingDir) {
        MDC.put("svnCommand", subcommand);
        MDC.put("svnWorkingDir", workingDir != null ? workingDir.toString() : "");
    }

    public static void clear() {
        MDC.remove("svnCommand");
        MDC.remove("svnWorkingDir");
    }
}
