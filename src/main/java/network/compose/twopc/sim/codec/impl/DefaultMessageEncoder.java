package network.compose.twopc.sim.codec.impl;

import network.compose.twopc.sim.codec.MessageEncoder;
import network.compose.twopc.sim.model.Block;
import network.compose.twopc.sim.model.ByteSequence;
import network.compose.twopc.sim.model.Decided;
import network.compose.twopc.sim.model.Message;
import network.compose.twopc.sim.model.MessagePayload;
import network.compose.twopc.sim.model.Vote;
import network.compose.twopc.sim.model.XTRequest;
import network.compose.twopc.sim.model.XtId;

import java.util.Objects;

/**
 * DefaultMessageEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link MessageEncoder}.
 *
 * <p>This is the mechanical inverse of {@link DefaultMessageDecoder}. The
 * envelope is written as:</p>
 * <pre>
 *   [ field 1: sender_id ][ field 2|3|4|5: payload (length-delimited) ]
 * </pre>
 *
 * <p>Every field is written explicitly, including default values (false
 * booleans, zero ids, empty byte strings), so the byte layout of a given
 * message never depends on its contents.</p>
 */
public final class DefaultMessageEncoder implements MessageEncoder
{
    @Override
    public byte[] encode(Message message)
    {
        Objects.requireNonNull(message, "message");

        ProtoWriter envelope = new ProtoWriter()
                .writeStringField(ProtocolFields.Envelope.SENDER_ID, message.senderId());

        MessagePayload payload = message.payload();
        if (payload instanceof XTRequest m) {
            envelope.writeMessageField(ProtocolFields.Envelope.XT_REQUEST, encodeXtRequest(m));
        }
        else if (payload instanceof Vote m) {
            envelope.writeMessageField(ProtocolFields.Envelope.VOTE, encodeVote(m));
        }
        else if (payload instanceof Decided m) {
            envelope.writeMessageField(ProtocolFields.Envelope.DECIDED, encodeDecided(m));
        }
        else if (payload instanceof Block m) {
            envelope.writeMessageField(ProtocolFields.Envelope.BLOCK, encodeBlock(m));
        }
        else {
            // Sealed interface should make this unreachable.
            throw new IllegalArgumentException("Unsupported payload type: " + payload.getClass());
        }

        return envelope.toByteArray();
    }

    private static ProtoWriter encodeXtRequest(XTRequest request)
    {
        ProtoWriter out = new ProtoWriter();
        for (XTRequest.TransactionRequest tx : request.transactions()) {
            ProtoWriter nested = new ProtoWriter()
                    .writeBytesField(ProtocolFields.TransactionRequest.CHAIN_ID,
                            tx.chainId().bytes().toByteArray());
            for (ByteSequence raw : tx.transactions()) {
                nested.writeBytesField(ProtocolFields.TransactionRequest.TRANSACTIONS, raw.toByteArray());
            }
            out.writeMessageField(ProtocolFields.XtRequest.TRANSACTIONS, nested);
        }
        return out;
    }

    private static ProtoWriter encodeVote(Vote vote)
    {
        return new ProtoWriter()
                .writeBytesField(ProtocolFields.Vote.SENDER_CHAIN_ID, vote.senderChainId().bytes().toByteArray())
                .writeVarintField(ProtocolFields.Vote.XT_ID, vote.xtId().value())
                .writeBoolField(ProtocolFields.Vote.VOTE, vote.commit());
    }

    private static ProtoWriter encodeDecided(Decided decided)
    {
        return new ProtoWriter()
                .writeVarintField(ProtocolFields.Decided.XT_ID, decided.xtId().value())
                .writeBoolField(ProtocolFields.Decided.DECISION, decided.commit());
    }

    private static ProtoWriter encodeBlock(Block block)
    {
        ProtoWriter out = new ProtoWriter()
                .writeBytesField(ProtocolFields.Block.CHAIN_ID, block.chainId().bytes().toByteArray())
                .writeBytesField(ProtocolFields.Block.BLOCK_DATA, block.blockData().toByteArray());
        // Unpacked: one tag + varint per id.
        for (XtId id : block.includedXtIds()) {
            out.writeVarintField(ProtocolFields.Block.INCLUDED_XT_IDS, id.value());
        }
        return out;
    }
}
