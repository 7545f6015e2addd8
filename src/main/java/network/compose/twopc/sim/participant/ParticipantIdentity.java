package network.compose.twopc.sim.participant;

import network.compose.twopc.sim.model.ChainId;

import java.util.Objects;

/**
 * Who a simulated sequencer claims to be.
 *
 * @param clientId sender id stamped on every outbound message
 * @param chainId  chain the sequencer votes and produces blocks for
 */
public record ParticipantIdentity(
        String clientId,
        ChainId chainId
) {
    public ParticipantIdentity {
        Objects.requireNonNull(clientId, "clientId");
        Objects.requireNonNull(chainId, "chainId");
        if (clientId.isBlank()) {
            throw new IllegalArgumentException("clientId must not be blank");
        }
    }

    @Override
    public String toString() {
        return clientId + "@" + chainId.toHex();
    }
}
