package network.compose.twopc.sim.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * ByteSequence
 * -----------------------------------------------------------------------------
 * Immutable, value-equal sequence of bytes.
 *
 * <p>Wire payloads (raw transactions, block data) are opaque byte strings.
 * Records holding them use this wrapper for value equality. Bytes are
 * copied on the way in and on the way out.</p>
 */
public final class ByteSequence
{
    public static final ByteSequence EMPTY = new ByteSequence(new byte[0]);

    private final byte[] bytes;

    private ByteSequence(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Creates a sequence holding a copy of {@code bytes}.
     */
    public static ByteSequence of(byte... bytes) {
        if (bytes == null || bytes.length == 0) {
            return EMPTY;
        }
        return new ByteSequence(bytes.clone());
    }

    /**
     * Creates a sequence holding the UTF-8 encoding of {@code text}.
     */
    public static ByteSequence ofUtf8(String text) {
        return of(text.getBytes(StandardCharsets.UTF_8));
    }

    public int length() {
        return bytes.length;
    }

    public boolean isEmpty() {
        return bytes.length == 0;
    }

    /**
     * Returns a copy of the underlying bytes.
     */
    public byte[] toByteArray() {
        return bytes.clone();
    }

    public String toUtf8() {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    public String toHex() {
        return HexFormat.of().formatHex(bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ByteSequence that)) return false;
        return Arrays.equals(bytes, that.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "ByteSequence[length=" + bytes.length + ", hex=" + toHex() + "]";
    }
}
