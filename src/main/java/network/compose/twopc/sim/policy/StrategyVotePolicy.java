package network.compose.twopc.sim.policy;

import network.compose.twopc.sim.model.XtId;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * {@link VotePolicy} for the built-in {@link VoteStrategy} variants.
 */
final class StrategyVotePolicy implements VotePolicy
{
    private final VoteStrategy strategy;
    private final VoteTiming timing;
    private final Random random;
    private final Duration baseDelay;

    StrategyVotePolicy(VoteStrategy strategy, VoteTiming timing, Random random) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.timing = Objects.requireNonNull(timing, "timing");
        this.random = Objects.requireNonNull(random, "random");
        this.baseDelay = timing.base().sample(random);
    }

    @Override
    public VoteDecision decide(XtId xtId) {
        return switch (strategy) {
            case COMMIT -> new VoteDecision(true, baseDelay);
            case ABORT -> new VoteDecision(false, baseDelay);
            case RANDOM -> new VoteDecision(random.nextBoolean(), baseDelay);
            case DELAY -> new VoteDecision(true, timing.late().sample(random));
        };
    }

    Duration baseDelay() {
        return baseDelay;
    }

    @Override
    public String toString() {
        return "StrategyVotePolicy[" + strategy + ", baseDelay=" + baseDelay + "]";
    }
}
