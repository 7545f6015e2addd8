package network.compose.twopc.sim.codec.impl;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Append-only writer for tag/value pairs.
 *
 * <p>Every length-delimited value is written as {@code tag, varint length,
 * bytes}. The length is always a varint, never a single raw byte, so values
 * longer than 127 bytes are framed correctly.</p>
 */
final class ProtoWriter
{
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    ProtoWriter writeVarintField(int fieldNumber, long value)
    {
        Varint.write(WireTag.make(fieldNumber, WireTag.VARINT), out);
        Varint.write(value, out);
        return this;
    }

    ProtoWriter writeBoolField(int fieldNumber, boolean value)
    {
        return writeVarintField(fieldNumber, value ? 1 : 0);
    }

    ProtoWriter writeBytesField(int fieldNumber, byte[] value)
    {
        Varint.write(WireTag.make(fieldNumber, WireTag.LENGTH_DELIMITED), out);
        Varint.write(value.length, out);
        out.writeBytes(value);
        return this;
    }

    ProtoWriter writeStringField(int fieldNumber, String value)
    {
        return writeBytesField(fieldNumber, value.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Writes a nested message as a length-delimited field.
     */
    ProtoWriter writeMessageField(int fieldNumber, ProtoWriter nested)
    {
        return writeBytesField(fieldNumber, nested.toByteArray());
    }

    byte[] toByteArray()
    {
        return out.toByteArray();
    }
}
