package network.compose.twopc.sim.codec.impl;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * LengthPrefixFraming
 * -----------------------------------------------------------------------------
 * Stream framing rules for the coordinator protocol.
 *
 * <p>Every message on the TCP stream is preceded by its serialized length as a
 * fixed 4-byte big-endian unsigned integer:</p>
 * <pre>
 *   [ length : 4 bytes, big-endian ][ message : length bytes ]
 * </pre>
 *
 * <p>This class only builds outbound frames. Inbound accumulation across
 * partial reads is handled by {@link LengthPrefixFrameReader}.</p>
 */
public final class LengthPrefixFraming
{
    /** Size of the length prefix. */
    public static final int HEADER_LENGTH = 4;

    /** Upper bound on accepted frame bodies unless configured otherwise (16 MiB). */
    public static final int DEFAULT_MAX_FRAME_LENGTH = 16 * 1024 * 1024;

    private LengthPrefixFraming() {}

    /**
     * Prefix {@code body} with its length.
     *
     * @param body serialized message bytes
     * @return a new array holding {@code [length][body]}
     */
    public static byte[] frame(byte[] body)
    {
        Objects.requireNonNull(body, "body");
        return ByteBuffer.allocate(HEADER_LENGTH + body.length)
                .putInt(body.length)
                .put(body)
                .array();
    }

    /**
     * Interpret a 4-byte header as an unsigned big-endian length.
     */
    static long readLength(byte[] header)
    {
        return ByteBuffer.wrap(header, 0, HEADER_LENGTH).getInt() & 0xFFFF_FFFFL;
    }
}
