package network.compose.twopc.sim.internal.state;

/**
 * Commit-protocol phase of one transaction as seen by one participant.
 *
 * <pre>
 *   IDLE → VOTING → COMMITTED
 *                 ↘ ABORTED
 * </pre>
 *
 * <p>Transitions never go backwards. {@code IDLE} is only ever observed as a
 * participant's coarse state before its first proposal.</p>
 */
public enum TransactionPhase {
    IDLE,
    VOTING,
    COMMITTED,
    ABORTED;

    public boolean isTerminal() {
        return this == COMMITTED || this == ABORTED;
    }
}
