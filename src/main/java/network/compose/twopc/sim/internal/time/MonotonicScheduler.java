package network.compose.twopc.sim.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Execution context of one participant.
 *
 * <h2>Serialization contract</h2>
 * Implementations MUST run submitted tasks one at a time. The participant
 * relies on this to confine all of its per-transaction state to a single
 * logical thread and to serialize writes to its connection without locks.
 *
 * <h2>Binding invariant</h2>
 * Deadlines are expressed in monotonic nanoseconds, never in wall-clock
 * instants.
 */
public interface MonotonicScheduler
{
    /**
     * Schedule a task to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos deadline from {@link MonotonicClock#nowNanos()}
     * @param task          runnable task
     */
    void scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Schedule {@code task} to run once {@code delay} has elapsed on {@code clock}.
     */
    default void scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        scheduleAtNanos(clock.nowNanos() + delay.toNanos(), task);
    }

    /**
     * Run {@code task} as soon as the scheduler is free.
     */
    default void execute(MonotonicClock clock, Runnable task)
    {
        scheduleAfter(Duration.ZERO, clock, task);
    }
}
