package network.compose.twopc.sim.model;

import java.util.Objects;

/**
 * The coordinator's binding decision for one proposal.
 *
 * @param xtId   the decided proposal
 * @param commit {@code true} if every participant voted commit
 */
public record Decided(
        XtId xtId,
        boolean commit
) implements MessagePayload
{
    public Decided {
        Objects.requireNonNull(xtId, "xtId");
    }
}
