package network.compose.twopc.sim.policy;

import network.compose.twopc.sim.internal.time.DurationRange;

import java.util.Objects;

/**
 * Delay ranges used by vote policies.
 *
 * <ul>
 *   <li><b>base</b>: range from which each participant draws its fixed vote
 *       delay once, at construction.</li>
 *   <li><b>late</b>: range from which {@link VoteStrategy#DELAY} draws a fresh
 *       delay for every vote. It should exceed the coordinator's
 *       vote-collection timeout.</li>
 * </ul>
 */
public record VoteTiming(
        DurationRange base,
        DurationRange late
) {
    public VoteTiming {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(late, "late");
    }

    /** 0.5 to 2.0 s base, 3 to 6 s late. */
    public static VoteTiming defaults() {
        return new VoteTiming(DurationRange.ofMillis(500, 2_000), DurationRange.ofMillis(3_000, 6_000));
    }
}
