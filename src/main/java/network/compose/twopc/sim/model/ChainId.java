package network.compose.twopc.sim.model;

import java.util.Objects;

/**
 * Strongly typed chain identifier.
 *
 * <h2>Why this type exists</h2>
 * <p>
 * On the wire a chain identifier is just a length-delimited byte string, the
 * same shape as a raw transaction or block payload. Keeping it as a distinct
 * type stops chain ids from being mixed up with opaque payload bytes in the
 * participant and harness code, and gives log lines a stable hex rendering.
 * </p>
 *
 * <p>
 * A chain id must carry at least one byte.
 * </p>
 */
public final class ChainId
{
    private final ByteSequence bytes;

    private ChainId(ByteSequence bytes) {
        this.bytes = bytes;
    }

    /**
     * Creates a chain id from raw bytes.
     *
     * @throws IllegalArgumentException if {@code bytes} is empty
     */
    public static ChainId of(byte... bytes) {
        return of(ByteSequence.of(bytes));
    }

    public static ChainId of(ByteSequence bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.isEmpty()) {
            throw new IllegalArgumentException("Chain id must not be empty");
        }
        return new ChainId(bytes);
    }

    public ByteSequence bytes() {
        return bytes;
    }

    public String toHex() {
        return "0x" + bytes.toHex();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChainId that)) return false;
        return bytes.equals(that.bytes);
    }

    @Override
    public int hashCode() {
        return bytes.hashCode();
    }

    @Override
    public String toString() {
        return "ChainId[" + toHex() + "]";
    }
}
