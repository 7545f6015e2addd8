package network.compose.twopc.sim.codec.impl;

import network.compose.twopc.sim.codec.DecodeError;
import network.compose.twopc.sim.codec.DecodeResult;
import network.compose.twopc.sim.codec.MessageDecoder;
import network.compose.twopc.sim.model.Block;
import network.compose.twopc.sim.model.ByteSequence;
import network.compose.twopc.sim.model.ChainId;
import network.compose.twopc.sim.model.Decided;
import network.compose.twopc.sim.model.Message;
import network.compose.twopc.sim.model.MessagePayload;
import network.compose.twopc.sim.model.Vote;
import network.compose.twopc.sim.model.XTRequest;
import network.compose.twopc.sim.model.XtId;

import java.util.ArrayList;
import java.util.List;

/**
 * DefaultMessageDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link MessageDecoder}.
 *
 * <p>This decoder walks tag/value pairs until the buffer is exhausted:</p>
 * <ol>
 *   <li>Recognised field with the expected wire type: decoded.</li>
 *   <li>Anything else: skipped according to its wire type (forward-compatible
 *       parsing). Only group wire types (3, 4) and reserved types (6, 7)
 *       cannot be skipped.</li>
 * </ol>
 *
 * <p><strong>Payload selection:</strong> fields 2 to 5 are a oneof. If more than
 * one appears, the last one on the wire wins. A message with none is rejected
 * as {@link DecodeError.Kind#MISSING_PAYLOAD}.</p>
 *
 * <p>Scalar fields absent from the wire take their zero value ({@code xt_id 0},
 * {@code false}). Chain ids have no meaningful zero value; an absent or empty
 * chain id is rejected.</p>
 */
public final class DefaultMessageDecoder implements MessageDecoder
{
    @Override
    public DecodeResult decode(byte[] frame)
    {
        if (frame == null) {
            return DecodeResult.rejected(DecodeError.Kind.TRUNCATED_MESSAGE, "null frame");
        }

        try {
            return DecodeResult.decoded(decodeEnvelope(new ProtoReader(frame)));
        }
        catch (WireFormatException e) {
            // Wire-level failure: drop the frame, keep the connection.
            return DecodeResult.rejected(e.kind(), e.getMessage());
        }
    }

    private static Message decodeEnvelope(ProtoReader in) throws WireFormatException
    {
        String senderId = "";
        MessagePayload payload = null;

        while (in.hasRemaining()) {
            long tag = in.readTag();
            int field = WireTag.fieldNumber(tag);
            int wireType = WireTag.wireType(tag);

            if (wireType != WireTag.LENGTH_DELIMITED) {
                in.skipField(field, wireType);
                continue;
            }

            switch (field) {
                case ProtocolFields.Envelope.SENDER_ID -> senderId = in.readString();
                case ProtocolFields.Envelope.XT_REQUEST -> payload = decodeXtRequest(in.readNested());
                case ProtocolFields.Envelope.VOTE -> payload = decodeVote(in.readNested());
                case ProtocolFields.Envelope.DECIDED -> payload = decodeDecided(in.readNested());
                case ProtocolFields.Envelope.BLOCK -> payload = decodeBlock(in.readNested());
                default -> in.skipField(field, wireType);
            }
        }

        if (payload == null) {
            throw new WireFormatException(DecodeError.Kind.MISSING_PAYLOAD,
                    "Message from '" + senderId + "' carries no payload");
        }
        return new Message(senderId, payload);
    }

    private static XTRequest decodeXtRequest(ProtoReader in) throws WireFormatException
    {
        List<XTRequest.TransactionRequest> transactions = new ArrayList<>();
        while (in.hasRemaining()) {
            long tag = in.readTag();
            int field = WireTag.fieldNumber(tag);
            int wireType = WireTag.wireType(tag);

            if (field == ProtocolFields.XtRequest.TRANSACTIONS && wireType == WireTag.LENGTH_DELIMITED) {
                transactions.add(decodeTransactionRequest(in.readNested()));
            } else {
                in.skipField(field, wireType);
            }
        }
        return new XTRequest(transactions);
    }

    private static XTRequest.TransactionRequest decodeTransactionRequest(ProtoReader in)
            throws WireFormatException
    {
        byte[] chainId = null;
        List<ByteSequence> raw = new ArrayList<>();
        while (in.hasRemaining()) {
            long tag = in.readTag();
            int field = WireTag.fieldNumber(tag);
            int wireType = WireTag.wireType(tag);

            if (field == ProtocolFields.TransactionRequest.CHAIN_ID && wireType == WireTag.LENGTH_DELIMITED) {
                chainId = in.readLengthDelimited();
            }
            else if (field == ProtocolFields.TransactionRequest.TRANSACTIONS && wireType == WireTag.LENGTH_DELIMITED) {
                raw.add(ByteSequence.of(in.readLengthDelimited()));
            }
            else {
                in.skipField(field, wireType);
            }
        }
        return new XTRequest.TransactionRequest(requireChainId(chainId, "TransactionRequest.chain_id"), raw);
    }

    private static Vote decodeVote(ProtoReader in) throws WireFormatException
    {
        byte[] chainId = null;
        long xtId = 0;
        boolean commit = false;
        while (in.hasRemaining()) {
            long tag = in.readTag();
            int field = WireTag.fieldNumber(tag);
            int wireType = WireTag.wireType(tag);

            if (field == ProtocolFields.Vote.SENDER_CHAIN_ID && wireType == WireTag.LENGTH_DELIMITED) {
                chainId = in.readLengthDelimited();
            }
            else if (field == ProtocolFields.Vote.XT_ID && wireType == WireTag.VARINT) {
                xtId = in.readVarint();
            }
            else if (field == ProtocolFields.Vote.VOTE && wireType == WireTag.VARINT) {
                commit = in.readVarint() != 0;
            }
            else {
                in.skipField(field, wireType);
            }
        }
        return new Vote(requireChainId(chainId, "Vote.sender_chain_id"), toXtId(xtId), commit);
    }

    private static Decided decodeDecided(ProtoReader in) throws WireFormatException
    {
        long xtId = 0;
        boolean commit = false;
        while (in.hasRemaining()) {
            long tag = in.readTag();
            int field = WireTag.fieldNumber(tag);
            int wireType = WireTag.wireType(tag);

            if (field == ProtocolFields.Decided.XT_ID && wireType == WireTag.VARINT) {
                xtId = in.readVarint();
            }
            else if (field == ProtocolFields.Decided.DECISION && wireType == WireTag.VARINT) {
                commit = in.readVarint() != 0;
            }
            else {
                in.skipField(field, wireType);
            }
        }
        return new Decided(toXtId(xtId), commit);
    }

    private static Block decodeBlock(ProtoReader in) throws WireFormatException
    {
        byte[] chainId = null;
        ByteSequence blockData = ByteSequence.EMPTY;
        List<XtId> included = new ArrayList<>();
        while (in.hasRemaining()) {
            long tag = in.readTag();
            int field = WireTag.fieldNumber(tag);
            int wireType = WireTag.wireType(tag);

            if (field == ProtocolFields.Block.CHAIN_ID && wireType == WireTag.LENGTH_DELIMITED) {
                chainId = in.readLengthDelimited();
            }
            else if (field == ProtocolFields.Block.BLOCK_DATA && wireType == WireTag.LENGTH_DELIMITED) {
                blockData = ByteSequence.of(in.readLengthDelimited());
            }
            else if (field == ProtocolFields.Block.INCLUDED_XT_IDS && wireType == WireTag.VARINT) {
                included.add(toXtId(in.readVarint()));
            }
            else if (field == ProtocolFields.Block.INCLUDED_XT_IDS && wireType == WireTag.LENGTH_DELIMITED) {
                // Packed encoding, as emitted by standard protobuf runtimes.
                ProtoReader packed = in.readNested();
                while (packed.hasRemaining()) {
                    included.add(toXtId(packed.readVarint()));
                }
            }
            else {
                in.skipField(field, wireType);
            }
        }
        return new Block(requireChainId(chainId, "Block.chain_id"), blockData, included);
    }

    private static ChainId requireChainId(byte[] bytes, String field) throws InvalidFieldValueException
    {
        if (bytes == null || bytes.length == 0) {
            throw new InvalidFieldValueException(field + " is missing or empty");
        }
        return ChainId.of(bytes);
    }

    private static XtId toXtId(long raw) throws InvalidFieldValueException
    {
        if (raw < XtId.MIN_VALUE || raw > XtId.MAX_VALUE) {
            throw new InvalidFieldValueException(
                    "xt_id " + Long.toUnsignedString(raw) + " does not fit in 32 bits");
        }
        return XtId.of(raw);
    }
}
