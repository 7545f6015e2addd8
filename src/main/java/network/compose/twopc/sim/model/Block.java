package network.compose.twopc.sim.model;

import java.util.List;
import java.util.Objects;

/**
 * Block inclusion confirmation sent by a sequencer after a commit decision.
 *
 * @param chainId       chain that produced the block
 * @param blockData     opaque block contents
 * @param includedXtIds proposals included in the block, in order
 */
public record Block(
        ChainId chainId,
        ByteSequence blockData,
        List<XtId> includedXtIds
) implements MessagePayload
{
    public Block {
        Objects.requireNonNull(chainId, "chainId");
        Objects.requireNonNull(blockData, "blockData");
        includedXtIds = List.copyOf(Objects.requireNonNull(includedXtIds, "includedXtIds"));
    }
}
