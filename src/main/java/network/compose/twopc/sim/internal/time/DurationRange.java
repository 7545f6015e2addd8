package network.compose.twopc.sim.internal.time;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * Closed range of durations from which simulated delays are drawn uniformly.
 *
 * @param min inclusive lower bound, non-negative
 * @param max inclusive upper bound, {@code >= min}
 */
public record DurationRange(
        Duration min,
        Duration max
) {
    public DurationRange {
        Objects.requireNonNull(min, "min");
        Objects.requireNonNull(max, "max");
        if (min.isNegative()) {
            throw new IllegalArgumentException("min must be non-negative");
        }
        if (max.compareTo(min) < 0) {
            throw new IllegalArgumentException("max must be >= min (min=" + min + ", max=" + max + ")");
        }
    }

    public static DurationRange ofMillis(long minMillis, long maxMillis) {
        return new DurationRange(Duration.ofMillis(minMillis), Duration.ofMillis(maxMillis));
    }

    public static DurationRange fixed(Duration value) {
        return new DurationRange(value, value);
    }

    /**
     * Draws a duration uniformly from {@code [min, max]} at nanosecond resolution.
     */
    public Duration sample(Random random) {
        long lo = min.toNanos();
        long span = max.toNanos() - lo;
        if (span == 0) {
            return min;
        }
        // nextDouble() is in [0, 1); scaling by span + 1 keeps max reachable.
        long offset = Math.min(span, (long) (random.nextDouble() * (span + 1)));
        return Duration.ofNanos(lo + offset);
    }
}
