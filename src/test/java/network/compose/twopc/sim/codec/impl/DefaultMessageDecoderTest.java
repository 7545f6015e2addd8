package network.compose.twopc.sim.codec.impl;

import network.compose.twopc.sim.codec.DecodeError;
import network.compose.twopc.sim.codec.DecodeResult;
import network.compose.twopc.sim.model.Block;
import network.compose.twopc.sim.model.ByteSequence;
import network.compose.twopc.sim.model.ChainId;
import network.compose.twopc.sim.model.Decided;
import network.compose.twopc.sim.model.Message;
import network.compose.twopc.sim.model.Vote;
import network.compose.twopc.sim.model.XTRequest;
import network.compose.twopc.sim.model.XtId;

import org.junit.jupiter.api.Test;

import java.util.List;

import static network.compose.twopc.sim.codec.impl.VarintTest.bytes;
import static org.junit.jupiter.api.Assertions.*;

class DefaultMessageDecoderTest
{
    private final DefaultMessageEncoder encoder = new DefaultMessageEncoder();
    private final DefaultMessageDecoder decoder = new DefaultMessageDecoder();

    private static final ChainId CHAIN = ChainId.of((byte) 0x12, (byte) 0x34);

    // ---------------------------------------------------------------------
    // Happy path
    // ---------------------------------------------------------------------

    @Test
    void decodesEveryPayloadVariantTheEncoderProduces()
    {
        List<Message> messages = List.of(
                new Message("sequencer-A", new XTRequest(List.of(
                        new XTRequest.TransactionRequest(CHAIN, List.of(
                                ByteSequence.of((byte) 1, (byte) 2), ByteSequence.EMPTY))))),
                new Message("sequencer-B", new Vote(CHAIN, XtId.of(0xFFFF_FFFFL), false)),
                new Message("publisher", new Decided(XtId.of(42), true)),
                new Message("sequencer-C", new Block(CHAIN, ByteSequence.ofUtf8("block"),
                        List.of(XtId.of(7), XtId.of(8)))));

        for (Message m : messages) {
            DecodeResult result = decoder.decode(encoder.encode(m));
            assertEquals(m, result.message().orElseThrow(), () -> "round trip of " + m);
        }
    }

    @Test
    void nonZeroBooleanDecodesAsTrue()
    {
        byte[] frame = bytes(
                0x0A, 0x00,
                0x22, 0x04, 0x08, 0x03, 0x10, 0x02);

        Decided decided = (Decided) decoder.decode(frame).message().orElseThrow().payload();
        assertEquals(XtId.of(3), decided.xtId());
        assertTrue(decided.commit());
    }

    @Test
    void absentScalarsTakeZeroValues()
    {
        // Decided with an empty body.
        byte[] frame = bytes(0x22, 0x00);

        Message message = decoder.decode(frame).message().orElseThrow();
        assertEquals("", message.senderId());
        assertEquals(new Decided(XtId.of(0), false), message.payload());
    }

    @Test
    void acceptsPackedIncludedXtIds()
    {
        byte[] frame = bytes(
                0x2A, 0x09,
                0x0A, 0x02, 0x12, 0x34,
                0x1A, 0x03, 0x01, 0xAC, 0x02);

        Block block = (Block) decoder.decode(frame).message().orElseThrow().payload();
        assertEquals(List.of(XtId.of(1), XtId.of(300)), block.includedXtIds());
    }

    @Test
    void lastPayloadOnTheWireWins()
    {
        byte[] frame = bytes(
                0x22, 0x02, 0x08, 0x01,
                0x22, 0x02, 0x08, 0x02);

        Decided decided = (Decided) decoder.decode(frame).message().orElseThrow().payload();
        assertEquals(XtId.of(2), decided.xtId());
    }

    // ---------------------------------------------------------------------
    // Forward compatibility
    // ---------------------------------------------------------------------

    @Test
    void skipsUnknownFieldsOfEverySkippableWireType()
    {
        byte[] frame = bytes(
                0x0A, 0x01, 'X',
                0x30, 0x96, 0x01,                       // field 6, varint
                0x3A, 0x02, 0xDE, 0xAD,                 // field 7, length-delimited
                0x41, 1, 2, 3, 4, 5, 6, 7, 8,           // field 8, fixed64
                0x4D, 1, 2, 3, 4,                       // field 9, fixed32
                0x22, 0x08,
                0x08, 0x09,
                0x18, 0x05,                             // unknown Decided field 3
                0x10, 0x01,
                0x08, 0x0A);                            // xt_id repeated: last wins

        Message message = decoder.decode(frame).message().orElseThrow();
        assertEquals("X", message.senderId());
        assertEquals(new Decided(XtId.of(10), true), message.payload());
    }

    @Test
    void knownFieldWithWrongWireTypeIsSkipped()
    {
        // Decided.xt_id sent as length-delimited.
        byte[] frame = bytes(0x22, 0x05, 0x0A, 0x01, 0x07, 0x10, 0x01);

        Decided decided = (Decided) decoder.decode(frame).message().orElseThrow().payload();
        assertEquals(new Decided(XtId.of(0), true), decided);
    }

    // ---------------------------------------------------------------------
    // Rejections
    // ---------------------------------------------------------------------

    @Test
    void emptyFrameIsMissingPayload()
    {
        assertRejected(DecodeError.Kind.MISSING_PAYLOAD, new byte[0]);
    }

    @Test
    void senderOnlyIsMissingPayload()
    {
        assertRejected(DecodeError.Kind.MISSING_PAYLOAD, bytes(0x0A, 0x01, 'A'));
    }

    @Test
    void declaredLengthBeyondBufferIsTruncated()
    {
        assertRejected(DecodeError.Kind.TRUNCATED_MESSAGE, bytes(0x0A, 0x05, 'A', 'B'));
    }

    @Test
    void nestedLengthBeyondParentIsTruncated()
    {
        // Vote body declares 3 bytes; chain id inside declares 4.
        assertRejected(DecodeError.Kind.TRUNCATED_MESSAGE, bytes(0x1A, 0x03, 0x0A, 0x04, 0x12));
    }

    @Test
    void varintCutOffAtEndOfBufferIsMalformed()
    {
        assertRejected(DecodeError.Kind.MALFORMED_VARINT, bytes(0x22, 0x02, 0x08, 0x80));
    }

    @Test
    void groupWireTypeIsRejected()
    {
        // Field 6, wire type 3 (start group).
        assertRejected(DecodeError.Kind.INVALID_WIRE_TYPE, bytes(0x33, 0x00));
    }

    @Test
    void emptyChainIdIsInvalid()
    {
        assertRejected(DecodeError.Kind.INVALID_FIELD_VALUE, bytes(0x1A, 0x06, 0x0A, 0x00, 0x10, 0x01, 0x18, 0x01));
    }

    @Test
    void xtIdWiderThan32BitsIsInvalid()
    {
        // 2^32 = 80 80 80 80 10
        assertRejected(DecodeError.Kind.INVALID_FIELD_VALUE, bytes(0x22, 0x06, 0x08, 0x80, 0x80, 0x80, 0x80, 0x10));
    }

    @Test
    void fieldNumberBeyondProtobufRangeIsInvalid()
    {
        // Field (2^32 | 4), wire type 2: its low 32 bits alias the Decided field.
        assertRejected(DecodeError.Kind.INVALID_FIELD_VALUE, bytes(
                0x0A, 0x01, 'x',
                0xA2, 0x80, 0x80, 0x80, 0x80, 0x01, 0x04, 0x08, 0x07, 0x10, 0x01));
    }

    @Test
    void fieldNumberZeroIsInvalid()
    {
        assertRejected(DecodeError.Kind.INVALID_FIELD_VALUE, bytes(0x0A, 0x01, 'x', 0x02, 0x00));
    }

    @Test
    void largestFieldNumberIsSkippedAsUnknown()
    {
        // Field 2^29-1, varint 0, then Decided{xt_id=7, commit=true}.
        byte[] frame = bytes(
                0x0A, 0x01, 'x',
                0xF8, 0xFF, 0xFF, 0xFF, 0x0F, 0x00,
                0x22, 0x04, 0x08, 0x07, 0x10, 0x01);

        DecodeResult.Decoded decoded = assertInstanceOf(DecodeResult.Decoded.class, decoder.decode(frame));
        assertEquals(new Decided(XtId.of(7), true), decoded.value().payload());
    }

    @Test
    void nullFrameIsRejectedNotThrown()
    {
        assertInstanceOf(DecodeResult.Rejected.class, decoder.decode(null));
    }

    private void assertRejected(DecodeError.Kind expected, byte[] frame)
    {
        DecodeResult result = decoder.decode(frame);
        DecodeResult.Rejected rejected = assertInstanceOf(DecodeResult.Rejected.class, result);
        assertEquals(expected, rejected.error().kind(), rejected.error().detail());
    }
}
