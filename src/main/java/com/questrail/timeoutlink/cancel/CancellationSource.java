package com.questrail.timeoutlink.cancel;

import com.questrail.timeoutlink.internal.time.Cancellable;
import com.questrail.timeoutlink.internal.time.MonotonicClock;
import com.questrail.timeoutlink.internal.time.MonotonicScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * CancellationSource
 * =============================================================================
 * Write side of a cooperative cancellation signal. Owns exactly one
 * {@link CancellationToken}.
 *
 * <h2>Kinds of source</h2>
 * <ul>
 *   <li>{@link #create()}: fired only by an explicit {@link #cancel()}
 *       (e.g. a transport reporting a client disconnect).</li>
 *   <li>{@link #cancelAfter(Duration, MonotonicScheduler, MonotonicClock)}:
 *       fired by a one-shot timer.</li>
 *   <li>{@link #linkedTo(CancellationToken...)}: fired as soon as any of its
 *       input tokens fires.</li>
 * </ul>
 *
 * <h2>Callback dispatch</h2>
 * <p>By default callbacks run on the thread that fires the source. A linked
 * source built with {@link #linkedTo(CallbackDispatch, CancellationToken...)}
 * and an {@link CallbackDispatch#async async} policy only flips its state on
 * the firing thread and hands its callbacks to an executor. Use that for any
 * token given to code you do not control: inputs are often fired by shared
 * timer or I/O threads.</p>
 *
 * <h2>Lifecycle</h2>
 * <p>{@link #close()} disarms a pending timer and unregisters this source from
 * the tokens it is linked to. It does not fire the token and does not drop
 * callbacks registered on it. A source closed before it fired will only fire
 * afterwards through an explicit {@link #cancel()}.</p>
 *
 * <h2>Thread safety</h2>
 * <p>All methods are thread-safe. {@link #cancel()} may race with
 * {@link CancellationToken#register(Runnable)} and {@link #close()}; every
 * callback still runs at most once.</p>
 */
public final class CancellationSource implements AutoCloseable {

    private static final Cancellable ALREADY_RAN = () -> false;

    private final Object lock = new Object();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CountDownLatch fired = new CountDownLatch(1);
    private final SourceToken token = new SourceToken();
    private final CallbackDispatch dispatch;

    // guarded by lock
    private final List<Callback> callbacks = new ArrayList<>();
    private final List<Cancellable> upstream = new ArrayList<>();
    private boolean closed;

    private CancellationSource(CallbackDispatch dispatch) {
        this.dispatch = dispatch;
    }

    public static CancellationSource create() {
        return new CancellationSource(CallbackDispatch.inline());
    }

    /**
     * Create a source that fires once {@code delay} has elapsed on {@code clock}.
     * A zero delay fires as soon as the scheduler runs the task.
     */
    public static CancellationSource cancelAfter(Duration delay, MonotonicScheduler scheduler, MonotonicClock clock) {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(scheduler, "scheduler");
        Objects.requireNonNull(clock, "clock");

        CancellationSource source = new CancellationSource(CallbackDispatch.inline());
        source.attach(scheduler.scheduleAfter(delay, clock, source::cancel));
        return source;
    }

    /**
     * Create a source that fires when any of {@code inputs} fires. If an input
     * has already fired the returned source is already cancelled.
     */
    public static CancellationSource linkedTo(CancellationToken... inputs) {
        return linkedTo(CallbackDispatch.inline(), inputs);
    }

    /**
     * Create a linked source whose callbacks run under {@code dispatch}.
     */
    public static CancellationSource linkedTo(CallbackDispatch dispatch, CancellationToken... inputs) {
        Objects.requireNonNull(dispatch, "dispatch");
        Objects.requireNonNull(inputs, "inputs");

        CancellationSource source = new CancellationSource(dispatch);
        for (CancellationToken input : inputs) {
            Objects.requireNonNull(input, "input");
            source.attach(input.register(source::cancel));
        }
        return source;
    }

    public CancellationToken token() {
        return token;
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    /**
     * Fire the token. Idempotent; only the first call runs callbacks.
     *
     * <p>With inline dispatch every callback runs even if an earlier one
     * throws, and the first failure is rethrown afterwards with the others
     * attached as suppressed. With async dispatch this method never throws
     * for a callback failure.</p>
     */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }

        List<Runnable> toRun = new ArrayList<>();
        synchronized (lock) {
            for (Callback callback : callbacks) {
                toRun.add(callback.task);
            }
            callbacks.clear();
        }

        if (!dispatch.isInline()) {
            // Waiters are released as soon as the state flips.
            fired.countDown();
            dispatch.dispatch(toRun);
            return;
        }

        try {
            dispatch.dispatch(toRun);
        } finally {
            fired.countDown();
        }
    }

    /**
     * Disarm the timer and unregister from linked inputs.
     */
    @Override
    public void close() {
        List<Cancellable> toRelease;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            toRelease = new ArrayList<>(upstream);
            upstream.clear();
        }
        toRelease.forEach(Cancellable::cancel);
    }

    private void attach(Cancellable registration) {
        synchronized (lock) {
            if (!closed) {
                upstream.add(registration);
                return;
            }
        }
        registration.cancel();
    }

    private Cancellable register(Runnable task) {
        Objects.requireNonNull(task, "callback");

        synchronized (lock) {
            if (!cancelled.get()) {
                Callback callback = new Callback(task);
                callbacks.add(callback);
                return callback;
            }
        }

        // Already fired: the snapshot in cancel() cannot contain this task.
        task.run();
        return ALREADY_RAN;
    }

    static long saturatedNanos(Duration duration) {
        if (duration.isNegative()) {
            return 0;
        }
        try {
            return duration.toNanos();
        } catch (ArithmeticException overflow) {
            return Long.MAX_VALUE;
        }
    }

    @Override
    public String toString() {
        return "CancellationSource[cancelled=" + cancelled.get() + "]";
    }

    private final class Callback implements Cancellable {
        private final Runnable task;

        private Callback(Runnable task) {
            this.task = task;
        }

        @Override
        public boolean cancel() {
            synchronized (lock) {
                return callbacks.remove(this);
            }
        }
    }

    private final class SourceToken implements CancellationToken {

        @Override
        public boolean isCancellationRequested() {
            return cancelled.get();
        }

        @Override
        public Cancellable register(Runnable callback) {
            return CancellationSource.this.register(callback);
        }

        @Override
        public boolean await(Duration timeout) throws InterruptedException {
            Objects.requireNonNull(timeout, "timeout");
            return fired.await(saturatedNanos(timeout), TimeUnit.NANOSECONDS);
        }

        @Override
        public String toString() {
            return "CancellationToken[cancelled=" + cancelled.get() + "]";
        }
    }
}
