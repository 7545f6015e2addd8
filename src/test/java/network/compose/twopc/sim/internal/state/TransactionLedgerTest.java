package network.compose.twopc.sim.internal.state;

import network.compose.twopc.sim.model.XtId;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TransactionLedgerTest {

    @Test
    void proposalIdsCountFromOne() {
        TransactionLedger ledger = new TransactionLedger();
        assertEquals(XtId.of(1), ledger.nextProposalId());
        assertEquals(XtId.of(2), ledger.nextProposalId());
        assertEquals(XtId.of(3), ledger.nextProposalId());
    }

    @Test
    void openRejectsSecondEntryForSameId() {
        TransactionLedger ledger = new TransactionLedger();
        assertTrue(ledger.open(XtId.of(1)));
        assertFalse(ledger.open(XtId.of(1)));
        assertEquals(1, ledger.size());
    }

    @Test
    void commitKeepsEntryUntilCompleted() {
        TransactionLedger ledger = new TransactionLedger();
        XtId id = XtId.of(1);
        ledger.open(id);
        ledger.recordVote(id, true);

        PendingTransaction resolved = ledger.resolve(id, true).orElseThrow();
        assertEquals(TransactionPhase.COMMITTED, resolved.phase());
        assertEquals(Optional.of(true), resolved.vote());
        assertEquals(1, ledger.size());

        ledger.complete(id);
        assertEquals(0, ledger.size());
    }

    @Test
    void abortRemovesEntryImmediately() {
        TransactionLedger ledger = new TransactionLedger();
        XtId id = XtId.of(4);
        ledger.open(id);

        PendingTransaction resolved = ledger.resolve(id, false).orElseThrow();
        assertEquals(TransactionPhase.ABORTED, resolved.phase());
        assertTrue(resolved.vote().isEmpty());
        assertTrue(ledger.get(id).isEmpty());
    }

    @Test
    void duplicateOrUnknownDecisionIsNoOp() {
        TransactionLedger ledger = new TransactionLedger();
        XtId id = XtId.of(1);
        ledger.open(id);

        assertTrue(ledger.resolve(id, true).isPresent());
        assertTrue(ledger.resolve(id, true).isEmpty());
        assertTrue(ledger.resolve(id, false).isEmpty());
        assertEquals(TransactionPhase.COMMITTED, ledger.get(id).orElseThrow().phase());

        assertTrue(ledger.resolve(XtId.of(99), true).isEmpty());
    }

    @Test
    void voteRecordedAfterResolutionIsKept() {
        TransactionLedger ledger = new TransactionLedger();
        XtId id = XtId.of(1);
        ledger.open(id);
        ledger.resolve(id, true);

        ledger.recordVote(id, true);
        assertEquals(Optional.of(true), ledger.get(id).orElseThrow().vote());
    }

    @Test
    void terminalPhaseCannotChange() {
        PendingTransaction committed = PendingTransaction.voting(XtId.of(1)).withPhase(TransactionPhase.COMMITTED);
        assertThrows(IllegalStateException.class, () -> committed.withPhase(TransactionPhase.ABORTED));
        assertThrows(IllegalStateException.class, () -> committed.withPhase(TransactionPhase.VOTING));
    }
}
