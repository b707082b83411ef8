package com.questrail.timeoutlink.internal.time;

import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * SharedDeadlineScheduler
 * =============================================================================
 * Process-wide deadline scheduler for gates built without an explicit one.
 *
 * <p>Backed by a single daemon thread created on first use, so it never keeps
 * the JVM alive. Cancelled timers are removed from the queue immediately; a
 * gate disarms its timer on every request that finishes early.</p>
 *
 * <p>The timer thread only flips cancellation state. Callbacks that downstream
 * code registers on a gate's combined token run on {@link #callbackExecutor()},
 * a daemon pool that grows with demand, so a slow callback of one request never
 * delays another request's deadline.</p>
 *
 * <p>Composition roots that manage their own lifecycle (see
 * {@code TimeoutLinkHttpRuntime}) create a dedicated
 * {@link ScheduledExecutorScheduler} instead.</p>
 */
public final class SharedDeadlineScheduler {

    private SharedDeadlineScheduler() {
    }

    public static MonotonicScheduler instance() {
        return Holder.SCHEDULER;
    }

    public static Executor callbackExecutor() {
        return CallbackHolder.EXECUTOR;
    }

    /**
     * Daemon thread factory naming threads {@code prefix-N}.
     */
    public static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = Executors.defaultThreadFactory().newThread(r);
            t.setName(prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static final class Holder {
        private static final MonotonicScheduler SCHEDULER =
            new ScheduledExecutorScheduler(newExecutor(), SystemMonotonicClock.INSTANCE);

        private static ScheduledExecutorService newExecutor() {
            ScheduledThreadPoolExecutor executor =
                new ScheduledThreadPoolExecutor(1, daemonThreads("timeout-link-deadline-timer"));
            executor.setRemoveOnCancelPolicy(true);
            return executor;
        }
    }

    private static final class CallbackHolder {
        private static final Executor EXECUTOR =
            Executors.newCachedThreadPool(daemonThreads("timeout-link-cancellation-callback"));
    }
}
