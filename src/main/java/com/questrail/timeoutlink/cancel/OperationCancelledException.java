package com.questrail.timeoutlink.cancel;

import java.util.Objects;

/**
 * Raised by code that observed a fired {@link CancellationToken} and unwound.
 *
 * <p>The token is carried so a handler can tell its own induced cancellation
 * apart from one it did not cause.</p>
 */
public class OperationCancelledException extends RuntimeException {

    private final transient CancellationToken token;

    public OperationCancelledException(CancellationToken token) {
        this("The operation was cancelled.", token);
    }

    public OperationCancelledException(String message, CancellationToken token) {
        super(message);
        this.token = Objects.requireNonNull(token, "token");
    }

    public OperationCancelledException(String message, CancellationToken token, Throwable cause) {
        super(message, cause);
        this.token = Objects.requireNonNull(token, "token");
    }

    /**
     * @return the token whose cancellation was observed
     */
    public CancellationToken token() {
        return token;
    }
}
