package network.compose.twopc.sim.participant;

import network.compose.twopc.sim.model.ByteSequence;
import network.compose.twopc.sim.model.ChainId;
import network.compose.twopc.sim.model.XTRequest;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ParticipantRosterTest {

    @Test
    void clientIdsCountInLetters() {
        assertEquals("sequencer-A", ParticipantRoster.clientIdFor(0));
        assertEquals("sequencer-C", ParticipantRoster.clientIdFor(2));
        assertEquals("sequencer-Z", ParticipantRoster.clientIdFor(25));
        assertEquals("sequencer-AA", ParticipantRoster.clientIdFor(26));
        assertEquals("sequencer-AB", ParticipantRoster.clientIdFor(27));
        assertEquals("sequencer-ZZ", ParticipantRoster.clientIdFor(701));
        assertEquals("sequencer-AAA", ParticipantRoster.clientIdFor(702));
    }

    @Test
    void firstThreeParticipantsUseWellKnownChains() {
        assertEquals("0x1234", ParticipantRoster.chainIdFor(0).toHex());
        assertEquals("0x1335", ParticipantRoster.chainIdFor(1).toHex());
        assertEquals("0x1436", ParticipantRoster.chainIdFor(2).toHex());
        assertEquals(ChainId.of((byte) 0x18, (byte) 0x3A), ParticipantRoster.chainIdFor(3));
    }

    @Test
    void identitiesAreDistinct() {
        Set<ChainId> chains = new HashSet<>();
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 200; i++) {
            ParticipantIdentity identity = ParticipantRoster.identityFor(i);
            assertTrue(ids.add(identity.clientId()), identity.clientId());
            assertTrue(chains.add(identity.chainId()), identity.chainId().toHex());
        }
    }

    @Test
    void negativeIndexIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ParticipantRoster.clientIdFor(-1));
        assertThrows(IllegalArgumentException.class, () -> ParticipantRoster.chainIdFor(-1));
    }

    @Test
    void defaultProposalNamesEachKnownChainOnce() {
        XTRequest proposal = DefaultProposal.create();

        assertEquals(3, proposal.transactions().size());
        for (int i = 0; i < 3; i++) {
            XTRequest.TransactionRequest request = proposal.transactions().get(i);
            assertEquals(ParticipantRoster.chainIdFor(i), request.chainId());
            assertEquals(List.of(ByteSequence.of((byte) 1, (byte) 2, (byte) 3, (byte) 4, (byte) (5 + i))),
                request.transactions());
        }
    }
}
