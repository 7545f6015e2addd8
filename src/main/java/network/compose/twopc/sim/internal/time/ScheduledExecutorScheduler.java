package network.compose.twopc.sim.internal.time;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * Production {@link MonotonicScheduler} backed by a
 * {@link ScheduledExecutorService}.
 *
 * <h2>Serialization</h2>
 * <p>The serialization contract of {@link MonotonicScheduler} holds only if the
 * executor has exactly one worker thread, as produced by
 * {@link java.util.concurrent.Executors#newSingleThreadScheduledExecutor}.</p>
 *
 * <h2>Executor Ownership</h2>
 * <p>This class does <strong>not</strong> own the executor. The harness shuts
 * it down when the run ends; tasks submitted after that are dropped and
 * logged at debug level.</p>
 *
 * <h2>Clock Consistency</h2>
 * <p>The same {@link MonotonicClock} must be used by callers computing
 * deadlines and by this class converting them to delays.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {

    private static final Logger log = LoggerFactory.getLogger(ScheduledExecutorScheduler.class);

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        // Deadlines in the past run immediately.
        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());

        try {
            executor.schedule(() -> runReportingFailures(task), delayNanos, TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Dropping task submitted after scheduler shutdown", e);
        }
    }

    // A ScheduledFuture nobody reads would hide the exception.
    private static void runReportingFailures(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Scheduled task failed", e);
        }
    }
}
