package com.example.shortsbot_backend.exception;

/**
 * Media toolkit invocation failed. Carries the tool's diagnostic output so it can be surfaced
 * as the failure reason.
 */
public class ExternalToolException extends ShortBuildException {
    private static final int MAX_DIAGNOSTIC_CHARS = 4_000;

    private final String label;
    private final int exitCode;
    private final boolean timedOut;
    private final String stderr;

    public ExternalToolException(String label, int exitCode, boolean timedOut, String stderr) {
        super(FailureKind.EXTERNAL_TOOL, describe(label, exitCode, timedOut, stderr));
        this.label = label;
        this.exitCode = exitCode;
        this.timedOut = timedOut;
        this.stderr = stderr == null ? "" : stderr;
    }

    public ExternalToolException(String label, String message, Throwable cause) {
        super(FailureKind.EXTERNAL_TOOL, label + " could not be started: " + message, cause);
        this.label = label;
        this.exitCode = -1;
        this.timedOut = false;
        this.stderr = "";
    }

    public String getLabel() {
        return label;
    }

    public int getExitCode() {
        return exitCode;
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    public String getStderr() {
        return stderr;
    }

    private static String describe(String label, int exitCode, boolean timedOut, String stderr) {
        String head = timedOut
                ? label + " timed out"
                : label + " failed with exit " + exitCode;
        if (stderr == null || stderr.isBlank()) {
            return head;
        }
        // ffmpeg prints the actual error at the end of stderr
        String tail = stderr.length() > MAX_DIAGNOSTIC_CHARS
                ? stderr.substring(stderr.length() - MAX_DIAGNOSTIC_CHARS)
                : stderr;
        return head + "\n---- stderr ----\n" + tail;
    }
}
