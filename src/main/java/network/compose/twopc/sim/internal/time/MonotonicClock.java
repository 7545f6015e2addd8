package network.compose.twopc.sim.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every delay the simulator schedules.
 *
 * <h2>Binding invariant</h2>
 * Vote delays, block settle delays and origination spacing are all computed
 * against a monotonic source. Wall-clock time ({@link WallClock}) is used only
 * for human-readable content such as block markers and log lines.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     *
     * <p>Values are only meaningful relative to each other.</p>
     */
    long nowNanos();
}
