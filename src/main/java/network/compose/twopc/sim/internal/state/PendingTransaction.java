package network.compose.twopc.sim.internal.state;

import network.compose.twopc.sim.model.XtId;

import java.util.Objects;
import java.util.Optional;

/**
 * PendingTransaction
 * -----------------------------------------------------------------------------
 * Immutable bookkeeping for one in-flight proposal.
 *
 * <p>{@code vote} is empty until the participant's vote has actually been
 * written to the connection.</p>
 */
public record PendingTransaction(
        XtId xtId,
        TransactionPhase phase,
        Optional<Boolean> vote
) {
    public PendingTransaction {
        Objects.requireNonNull(xtId, "xtId");
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(vote, "vote");
    }

    public static PendingTransaction voting(XtId xtId) {
        return new PendingTransaction(xtId, TransactionPhase.VOTING, Optional.empty());
    }

    public PendingTransaction withPhase(TransactionPhase newPhase) {
        if (phase.isTerminal() && newPhase != phase) {
            throw new IllegalStateException("xt_id " + xtId + " already " + phase + ", cannot move to " + newPhase);
        }
        return new PendingTransaction(xtId, newPhase, vote);
    }

    public PendingTransaction withVote(boolean commit) {
        return new PendingTransaction(xtId, phase, Optional.of(commit));
    }
}
