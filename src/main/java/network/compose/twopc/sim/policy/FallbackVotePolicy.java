package network.compose.twopc.sim.policy;

import network.compose.twopc.sim.model.XtId;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Guards a {@link VotePolicy}: if the delegate throws or returns {@code null},
 * the vote becomes a commit after {@code fallbackDelay}.
 */
public final class FallbackVotePolicy implements VotePolicy
{
    private static final Logger log = LoggerFactory.getLogger(FallbackVotePolicy.class);

    private final VotePolicy delegate;
    private final Duration fallbackDelay;

    public FallbackVotePolicy(VotePolicy delegate, Duration fallbackDelay) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.fallbackDelay = Objects.requireNonNull(fallbackDelay, "fallbackDelay");
    }

    @Override
    public VoteDecision decide(XtId xtId) {
        try {
            VoteDecision decision = delegate.decide(xtId);
            if (decision != null) {
                return decision;
            }
            log.warn("Vote policy {} returned no decision for xt_id={}; voting commit", delegate, xtId);
        } catch (RuntimeException e) {
            log.warn("Vote policy {} failed for xt_id={}; voting commit", delegate, xtId, e);
        }
        return new VoteDecision(true, fallbackDelay);
    }

    public Duration fallbackDelay() {
        return fallbackDelay;
    }
}
