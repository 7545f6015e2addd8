package network.compose.twopc.sim.internal.time;

/**
 * {@link MonotonicClock} backed by {@link System#nanoTime()}.
 *
 * <p>Thread-safe. Tests use {@code ManualMonotonicClock} instead.</p>
 */
public enum SystemMonotonicClock implements MonotonicClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
