package network.compose.twopc.sim.model;

import java.util.Objects;

/**
 * A participant's vote on one proposal.
 *
 * @param senderChainId chain of the voting sequencer
 * @param xtId          the proposal being voted on
 * @param commit        {@code true} to commit, {@code false} to abort
 */
public record Vote(
        ChainId senderChainId,
        XtId xtId,
        boolean commit
) implements MessagePayload
{
    public Vote {
        Objects.requireNonNull(senderChainId, "senderChainId");
        Objects.requireNonNull(xtId, "xtId");
    }
}
