package network.compose.twopc.sim.participant;

import network.compose.twopc.sim.model.ByteSequence;
import network.compose.twopc.sim.model.ChainId;
import network.compose.twopc.sim.model.XTRequest;

import java.util.ArrayList;
import java.util.List;

/**
 * The proposal an initiating participant originates.
 *
 * <p>It names the three well-known chains, each with one placeholder
 * transaction {@code 01 02 03 04 (05+i)} where {@code i} is the chain's index.</p>
 */
public final class DefaultProposal
{
    public static final List<ChainId> CHAINS = List.of(
            ChainId.of((byte) 0x12, (byte) 0x34),
            ChainId.of((byte) 0x13, (byte) 0x35),
            ChainId.of((byte) 0x14, (byte) 0x36));

    private DefaultProposal() {}

    public static XTRequest create() {
        List<XTRequest.TransactionRequest> requests = new ArrayList<>(CHAINS.size());
        for (int i = 0; i < CHAINS.size(); i++) {
            ByteSequence tx = ByteSequence.of((byte) 0x01, (byte) 0x02, (byte) 0x03, (byte) 0x04, (byte) (0x05 + i));
            requests.add(new XTRequest.TransactionRequest(CHAINS.get(i), List.of(tx)));
        }
        return new XTRequest(requests);
    }
}
