package com.questrail.timeoutlink.gate;

/**
 * Which of the two linked inputs fired the combined cancellation signal, and
 * the terminal status the gate answers with for it.
 */
public enum CancellationCause {

    /**
     * The deadline timer fired: the host budget minus the safety buffer ran
     * out. Answered with 504 Gateway Timeout.
     */
    DEADLINE_EXCEEDED(504, "host deadline"),

    /**
     * The original request signal fired: the client went away or the
     * transport aborted. Answered with the non-standard 499 Client Closed
     * Request used by proxies such as nginx.
     */
    CALLER_DISCONNECTED(499, "client disconnect");

    private final int statusCode;
    private final String description;

    CancellationCause(int statusCode, String description) {
        this.statusCode = statusCode;
        this.description = description;
    }

    public int statusCode() {
        return statusCode;
    }

    public String description() {
        return description;
    }
}
