package com.questrail.timeoutlink.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Handle returned by anything that arms work to happen later: a scheduled
 * deadline timer, or a callback registered on a cancellation token.
 *
 * <p>
 * Calling {@link #cancel()} only prevents the deferred work from running. It
 * never interrupts work that is already executing.
 * </p>
 */
public interface Cancellable
{
    /**
     * Disarm the deferred work.
     *
     * @return {@code true} if this call disarmed it; {@code false} if it had
     *         already run or was disarmed earlier.
     */
    boolean cancel();
}
