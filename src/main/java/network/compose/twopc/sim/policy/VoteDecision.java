package network.compose.twopc.sim.policy;

import java.time.Duration;
import java.util.Objects;

/**
 * What to vote, and how long to wait before sending it.
 */
public record VoteDecision(
        boolean commit,
        Duration delay
) {
    public VoteDecision {
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be non-negative");
        }
    }
}
