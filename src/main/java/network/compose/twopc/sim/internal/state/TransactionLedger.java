package network.compose.twopc.sim.internal.state;

import network.compose.twopc.sim.model.XtId;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * TransactionLedger
 * -----------------------------------------------------------------------------
 * Per-participant in-flight transaction set plus the local proposal counter.
 *
 * <h2>Proposal counter</h2>
 * The wire {@code XTRequest} carries no transaction id. The coordinator numbers
 * proposals sequentially from 1, so the participant infers the id of each
 * proposal it observes by counting. This is advisory: if the coordinator's
 * numbering diverges (a proposal this participant never saw), local ids drift.
 *
 * <h2>Lifecycle of an entry</h2>
 * <ul>
 *   <li>{@link #open(XtId)} creates a {@code VOTING} entry.</li>
 *   <li>{@link #resolve(XtId, boolean)} moves it to {@code COMMITTED} (kept
 *       until the block confirmation is sent) or {@code ABORTED} (removed).</li>
 *   <li>{@link #complete(XtId)} removes a committed entry.</li>
 * </ul>
 *
 * <h2>Thread confinement</h2>
 * Not thread-safe. Owned by one participant and touched only from that
 * participant's scheduler.
 */
public final class TransactionLedger
{
    private final Map<XtId, PendingTransaction> pending = new LinkedHashMap<>();
    private long lastProposal;

    /**
     * Advance the proposal counter and return the inferred id of the new proposal.
     */
    public XtId nextProposalId() {
        XtId id = XtId.of(lastProposal + 1);
        lastProposal = id.value();
        return id;
    }

    /**
     * Start tracking {@code xtId} in {@code VOTING}.
     *
     * @return {@code false} if an entry for {@code xtId} is already outstanding
     */
    public boolean open(XtId xtId) {
        Objects.requireNonNull(xtId, "xtId");
        return pending.putIfAbsent(xtId, PendingTransaction.voting(xtId)) == null;
    }

    /**
     * Record that the vote for {@code xtId} was sent. No-op if the entry is gone.
     */
    public void recordVote(XtId xtId, boolean commit) {
        pending.computeIfPresent(xtId, (id, tx) -> tx.withVote(commit));
    }

    /**
     * Apply the coordinator's decision.
     *
     * @return the resolved entry, or empty if there was no entry in
     *         {@code VOTING} (unknown id or duplicate decision)
     */
    public Optional<PendingTransaction> resolve(XtId xtId, boolean commit) {
        PendingTransaction tx = pending.get(xtId);
        if (tx == null || tx.phase() != TransactionPhase.VOTING) {
            return Optional.empty();
        }

        if (commit) {
            PendingTransaction committed = tx.withPhase(TransactionPhase.COMMITTED);
            pending.put(xtId, committed);
            return Optional.of(committed);
        }

        pending.remove(xtId);
        return Optional.of(tx.withPhase(TransactionPhase.ABORTED));
    }

    /**
     * Drop a committed entry once its block confirmation has been sent.
     */
    public void complete(XtId xtId) {
        pending.remove(xtId);
    }

    public Optional<PendingTransaction> get(XtId xtId) {
        return Optional.ofNullable(pending.get(xtId));
    }

    public int size() {
        return pending.size();
    }

    public List<PendingTransaction> snapshot() {
        return List.copyOf(pending.values());
    }
}
