package network.compose.twopc.sim.time;

import network.compose.twopc.sim.internal.time.MonotonicClock;

import java.time.Duration;

/**
 * Monotonic clock that only moves when a test moves it.
 *
 * <p>Participant timers are expressed as {@link Duration}s, so the clock is
 * advanced the same way. {@link #elapsed()} reports how far it has moved since
 * construction, which keeps assertions free of raw nanosecond arithmetic.</p>
 */
public final class ManualMonotonicClock implements MonotonicClock {

    private final long originNanos;
    private volatile long nowNanos;

    public ManualMonotonicClock() {
        this(0L);
    }

    /**
     * @param originNanos starting reading; a non-zero origin catches code that
     *                    treats a monotonic reading as an absolute time
     */
    public ManualMonotonicClock(long originNanos) {
        this.originNanos = originNanos;
        this.nowNanos = originNanos;
    }

    @Override
    public long nowNanos() {
        return nowNanos;
    }

    public Duration elapsed() {
        return Duration.ofNanos(nowNanos - originNanos);
    }

    public void advance(Duration delta) {
        if (delta.isNegative()) {
            throw new IllegalArgumentException("Cannot move the clock back by " + delta);
        }
        nowNanos += delta.toNanos();
    }

    /**
     * Moves the clock to {@code deadlineNanos} if that lies ahead; earlier
     * deadlines leave it where it is.
     */
    public void advanceTo(long deadlineNanos) {
        if (deadlineNanos > nowNanos) {
            nowNanos = deadlineNanos;
        }
    }
}
