package network.compose.twopc.sim.codec.impl;

import java.io.ByteArrayOutputStream;

/**
 * Varint
 * -----------------------------------------------------------------------------
 * Base-128 variable-length unsigned integer encoding.
 *
 * <p>Each byte carries 7 data bits, least significant group first. The high
 * bit (continuation bit) is set on every byte except the last.</p>
 *
 * <pre>
 *   0      → 00
 *   127    → 7F
 *   128    → 80 01
 *   16384  → 80 80 01
 * </pre>
 *
 * <p>Values are treated as unsigned 64-bit quantities, so at most
 * {@link #MAX_BYTES} bytes are ever produced. Decoding lives in
 * {@link ProtoReader#readVarint()}.</p>
 */
final class Varint
{
    /** Maximum encoded size of a 64-bit varint. */
    static final int MAX_BYTES = 10;

    private static final int CONTINUATION = 0x80;
    private static final int DATA_MASK = 0x7F;

    private Varint() {}

    static void write(long value, ByteArrayOutputStream out)
    {
        long v = value;
        // Unsigned comparison: negative longs are large unsigned values.
        while ((v & ~((long) DATA_MASK)) != 0) {
            out.write((int) ((v & DATA_MASK) | CONTINUATION));
            v >>>= 7;
        }
        out.write((int) v);
    }

    static byte[] encode(long value)
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream(MAX_BYTES);
        write(value, out);
        return out.toByteArray();
    }

    static int encodedSize(long value)
    {
        int size = 1;
        long v = value >>> 7;
        while (v != 0) {
            size++;
            v >>>= 7;
        }
        return size;
    }
}
