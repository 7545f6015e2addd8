package network.compose.twopc.sim.codec.impl;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Cursor over a complete message buffer.
 *
 * <p>The reader never reads past the end of its buffer: every length is
 * checked against the remaining bytes before it is honoured.</p>
 */
final class ProtoReader
{
    private final byte[] buffer;
    private final int limit;
    private int position;

    ProtoReader(byte[] buffer)
    {
        this(buffer, 0, buffer.length);
    }

    private ProtoReader(byte[] buffer, int offset, int limit)
    {
        this.buffer = buffer;
        this.position = offset;
        this.limit = limit;
    }

    boolean hasRemaining()
    {
        return position < limit;
    }

    int remaining()
    {
        return limit - position;
    }

    /**
     * Reads a field tag.
     *
     * @throws InvalidFieldValueException if the field number is 0 or above
     *         {@link WireTag#MAX_FIELD_NUMBER}
     */
    long readTag() throws WireFormatException
    {
        long tag = readVarint();
        long fieldNumber = tag >>> 3;
        if (fieldNumber < WireTag.MIN_FIELD_NUMBER || fieldNumber > WireTag.MAX_FIELD_NUMBER) {
            throw new InvalidFieldValueException(
                    "Field number " + Long.toUnsignedString(fieldNumber) + " is outside 1.."
                            + WireTag.MAX_FIELD_NUMBER);
        }
        return tag;
    }

    /**
     * Reads one varint.
     *
     * @throws MalformedVarintException if the buffer ends before a byte with the
     *         continuation bit clear, or the varint is longer than 10 bytes
     */
    long readVarint() throws MalformedVarintException
    {
        long result = 0;
        int shift = 0;
        for (int i = 0; i < Varint.MAX_BYTES; i++) {
            if (position >= limit) {
                throw new MalformedVarintException(
                        "Buffer ended inside varint after " + i + " byte(s)");
            }
            int b = buffer[position++] & 0xFF;
            result |= (long) (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                return result;
            }
            shift += 7;
        }
        throw new MalformedVarintException("Varint longer than " + Varint.MAX_BYTES + " bytes");
    }

    byte[] readLengthDelimited() throws MalformedVarintException, TruncatedMessageException
    {
        int length = readLength();
        byte[] value = Arrays.copyOfRange(buffer, position, position + length);
        position += length;
        return value;
    }

    String readString() throws MalformedVarintException, TruncatedMessageException
    {
        return new String(readLengthDelimited(), StandardCharsets.UTF_8);
    }

    /**
     * Returns a reader confined to the next length-delimited value and advances
     * past it.
     */
    ProtoReader readNested() throws MalformedVarintException, TruncatedMessageException
    {
        int length = readLength();
        ProtoReader nested = new ProtoReader(buffer, position, position + length);
        position += length;
        return nested;
    }

    /**
     * Skips the value of a field whose tag has already been read.
     */
    void skipField(int fieldNumber, int wireType) throws WireFormatException
    {
        switch (wireType) {
            case WireTag.VARINT -> readVarint();
            case WireTag.LENGTH_DELIMITED -> position += readLength();
            case WireTag.FIXED64 -> skipFixed(8);
            case WireTag.FIXED32 -> skipFixed(4);
            default -> throw new InvalidWireTypeException(fieldNumber, wireType);
        }
    }

    private void skipFixed(int width) throws TruncatedMessageException
    {
        if (remaining() < width) {
            throw new TruncatedMessageException(
                    "Fixed-width field needs " + width + " bytes, " + remaining() + " remain");
        }
        position += width;
    }

    private int readLength() throws MalformedVarintException, TruncatedMessageException
    {
        long length = readVarint();
        if (length < 0 || length > remaining()) {
            throw new TruncatedMessageException(
                    "Declared length " + Long.toUnsignedString(length)
                            + " exceeds remaining " + remaining() + " byte(s)");
        }
        return (int) length;
    }
}
