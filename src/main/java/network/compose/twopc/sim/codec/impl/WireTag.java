package network.compose.twopc.sim.codec.impl;

/**
 * Field tags: {@code (fieldNumber << 3) | wireType}.
 *
 * <p>Only {@link #VARINT} and {@link #LENGTH_DELIMITED} are produced by this
 * protocol. {@link #FIXED64} and {@link #FIXED32} are understood so that
 * unknown fields of those shapes can be skipped.</p>
 */
final class WireTag
{
    static final int VARINT = 0;
    static final int FIXED64 = 1;
    static final int LENGTH_DELIMITED = 2;
    static final int FIXED32 = 5;

    static final long MIN_FIELD_NUMBER = 1;
    static final long MAX_FIELD_NUMBER = (1L << 29) - 1;

    private static final int TYPE_BITS = 3;
    private static final int TYPE_MASK = (1 << TYPE_BITS) - 1;

    private WireTag() {}

    static int make(int fieldNumber, int wireType)
    {
        return (fieldNumber << TYPE_BITS) | wireType;
    }

    /**
     * Only valid for tags returned by {@link ProtoReader#readTag()}, whose
     * field numbers fit in an {@code int}.
     */
    static int fieldNumber(long tag)
    {
        return (int) (tag >>> TYPE_BITS);
    }

    static int wireType(long tag)
    {
        return (int) (tag & TYPE_MASK);
    }
}
