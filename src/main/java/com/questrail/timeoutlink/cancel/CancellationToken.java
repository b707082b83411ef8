package com.questrail.timeoutlink.cancel;

import com.questrail.timeoutlink.internal.time.Cancellable;

import java.time.Duration;

/**
 * CancellationToken
 * =============================================================================
 * Read side of a cooperative cancellation signal.
 *
 * <p>A token is observed by downstream code; only the owning
 * {@link CancellationSource} can fire it. Once fired it stays fired.</p>
 *
 * <h2>Callbacks</h2>
 * <ul>
 *   <li>Callbacks run exactly once, on the thread that fires the source, in
 *       registration order.</li>
 *   <li>Registering on an already-fired token runs the callback inline on the
 *       registering thread before {@link #register(Runnable)} returns.</li>
 * </ul>
 *
 * <h2>Identity</h2>
 * <p>Tokens compare by identity. Code that catches an
 * {@link OperationCancelledException} decides whether it caused the failure
 * by comparing {@link OperationCancelledException#token()} against the tokens
 * it owns.</p>
 */
public interface CancellationToken {

    /**
     * Token that is never cancelled.
     */
    CancellationToken NONE = NeverCancelledToken.INSTANCE;

    boolean isCancellationRequested();

    /**
     * Register a callback to run when the token fires.
     *
     * @param callback callback to run once
     * @return handle that unregisters the callback; returns {@code false} from
     *         {@link Cancellable#cancel()} if the callback already ran
     */
    Cancellable register(Runnable callback);

    /**
     * Block until the token fires or {@code timeout} elapses.
     *
     * @return {@code true} if the token fired
     * @throws InterruptedException if the waiting thread is interrupted
     */
    boolean await(Duration timeout) throws InterruptedException;

    /**
     * @throws OperationCancelledException carrying this token, if it has fired
     */
    default void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new OperationCancelledException(this);
        }
    }
}
