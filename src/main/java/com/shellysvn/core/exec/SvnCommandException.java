package com.shellysvn.core.exec;

/**
 * Thrown when an svn invocation does not complete with exit code 0.
 *
 * <p>The message is svn's own stderr text when there was any, which is meant
 * to be shown to the user as is.
 */
public class SvnCommandException extends RuntimeException {

    /** Exit code used when the process never ran to completion. */
    public static final int NO_EXIT_CODE = -1;

    private final int exitCode;
    private final String stdout;
    private final String stderr;
    private final SvnFailureKind failureKind;

    public SvnCommandException(String message, int exitCode, String stdout, String stderr,
                               SvnFailureKind failureKind) {
        super(message);
        this.exitCode = exitCode;
        this.stdout = stdout;
        this.stderr = stderr;
        this.failureKind = failureKind;
    }

    public SvnCommandException(String message, SvnFailureKind failureKind, Throwable cause) {
        super(message, cause);
        this.exitCode = NO_EXIT_CODE;
        this.stdout = "";
        this.stderr = "";
        this.failureKind = failureKind;
    }

    /**
     * Builds the exception for a process that exited with a non-zero code.
     */
    public static SvnCommandException forExit(int exitCode, String stdout, String stderr) {
        String message = stderr == null || stderr.isBlank()
                ? "svn exited with code " + exitCode
                : stderr.strip();
        return new SvnCommandException(message, exitCode, stdout, stderr,
                StderrClassifier.classify(stderr));
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getStdout() {
        return stdout;
    }

    public String getStderr() {
        return stderr;
    }

    public SvnFailureKind getFailureKind() {
        return failureKind;
    }
}
