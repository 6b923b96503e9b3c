package io.vidsort4j.tools;

import java.io.IOException;

/**
 * An external tool could not be started, timed out, or exited with a non-zero code.
 */
public class ToolException extends IOException {

    private final String tool;
    private final int exitCode;
    private final String detail;
    private final boolean timedOut;

    public ToolException(String tool, int exitCode, String detail, boolean timedOut, Throwable cause) {
        super(tool + " failed (exit " + exitCode + "): " + detail, cause);
        this.tool = tool;
        this.exitCode = exitCode;
        this.detail = detail;
        this.timedOut = timedOut;
    }

    public String tool() {
        return tool;
    }

    public int exitCode() {
        return exitCode;
    }

    /**
     * Tail of stderr, or a short reason when the tool never ran.
     */
    public String detail() {
        return detail;
    }

    public boolean timedOut() {
        return timedOut;
    }
}
