package network.compose.twopc.sim.codec.impl;

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

class DefaultMessageEncoderTest
{
    private final DefaultMessageEncoder encoder = new DefaultMessageEncoder();

    private static final ChainId CHAIN = ChainId.of((byte) 0x12, (byte) 0x34);

    @Test
    void encodesVoteFieldByField()
    {
        byte[] encoded = encoder.encode(new Message("A", new Vote(CHAIN, XtId.of(1), true)));

        byte[] expected = bytes(
                0x0A, 0x01, 'A',                 // sender_id
                0x1A, 0x08,                       // Vote, 8 bytes
                0x0A, 0x02, 0x12, 0x34,           //   sender_chain_id
                0x10, 0x01,                       //   xt_id
                0x18, 0x01);                      //   vote
        assertArrayEquals(expected, encoded);
    }

    @Test
    void defaultValuedFieldsAreStillEmitted()
    {
        byte[] encoded = encoder.encode(new Message("", new Decided(XtId.of(0), false)));

        byte[] expected = bytes(
                0x0A, 0x00,
                0x22, 0x04,
                0x08, 0x00,
                0x10, 0x00);
        assertArrayEquals(expected, encoded);
    }

    @Test
    void blockIdsAreWrittenUnpacked()
    {
        Block block = new Block(CHAIN, ByteSequence.of((byte) 0xAB), List.of(XtId.of(1), XtId.of(300)));
        byte[] encoded = encoder.encode(new Message("B", block));

        byte[] expected = bytes(
                0x0A, 0x01, 'B',
                0x2A, 0x0C,
                0x0A, 0x02, 0x12, 0x34,
                0x12, 0x01, 0xAB,
                0x18, 0x01,
                0x18, 0xAC, 0x02);
        assertArrayEquals(expected, encoded);
    }

    @Test
    void longBlockDataGetsMultiByteLength()
    {
        byte[] data = new byte[128];
        byte[] encoded = encoder.encode(new Message("B", new Block(CHAIN, ByteSequence.of(data), List.of())));

        // envelope: 0A 01 'B' | 2A <len> | 0A 02 12 34 | 12 80 01 <128 bytes>
        int blockBodyLength = 4 + 3 + 128;
        assertEquals(0x2A, encoded[3]);
        assertEquals((byte) (0x80 | (blockBodyLength & 0x7F)), encoded[4]);
        assertEquals(blockBodyLength >> 7, encoded[5]);
        assertEquals(0x12, encoded[10]);
        assertEquals((byte) 0x80, encoded[11]);
        assertEquals(0x01, encoded[12]);
        assertEquals(13 + 128, encoded.length);
    }

    @Test
    void xtRequestNestsOneEntryPerChain()
    {
        XTRequest request = new XTRequest(List.of(
                new XTRequest.TransactionRequest(CHAIN, List.of(ByteSequence.of((byte) 0x01))),
                new XTRequest.TransactionRequest(ChainId.of((byte) 0x13, (byte) 0x35), List.of())));

        byte[] encoded = encoder.encode(new Message("A", request));

        byte[] expected = bytes(
                0x0A, 0x01, 'A',
                0x12, 0x0F,
                0x0A, 0x07,                       // TransactionRequest #1
                0x0A, 0x02, 0x12, 0x34,
                0x12, 0x01, 0x01,
                0x0A, 0x04,                       // TransactionRequest #2
                0x0A, 0x02, 0x13, 0x35);
        assertArrayEquals(expected, encoded);
    }
}
