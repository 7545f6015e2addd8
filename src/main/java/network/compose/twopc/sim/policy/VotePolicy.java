package network.compose.twopc.sim.policy;

import network.compose.twopc.sim.model.XtId;

import java.util.Random;

/**
 * Maps a proposal to a vote and a send delay.
 *
 * <p>Policies are per participant. They may keep private state (a random
 * generator, a delay drawn at construction) and are always invoked from the
 * owning participant's scheduler, never concurrently.</p>
 *
 * <p>Implementations should not throw. The participant guards every call with
 * {@link FallbackVotePolicy} so that a failing policy degrades to a commit
 * vote instead of stopping the participant.</p>
 */
@FunctionalInterface
public interface VotePolicy
{
    VoteDecision decide(XtId xtId);

    /**
     * Resolve a strategy into a policy. The base delay is drawn here, once.
     */
    static VotePolicy forStrategy(VoteStrategy strategy, VoteTiming timing, Random random) {
        return new StrategyVotePolicy(strategy, timing, random);
    }
}
