package network.compose.twopc.sim.codec.impl;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.util.Objects;

/**
 * LengthPrefixFrameReader
 * -----------------------------------------------------------------------------
 * Reads length-prefixed frames from a blocking {@link InputStream}.
 *
 * <h2>Partial reads</h2>
 * <p>A socket may return fewer bytes than requested. The reader loops until
 * exactly 4 header bytes and then exactly {@code length} body bytes have been
 * accumulated.</p>
 *
 * <h2>Read timeouts</h2>
 * <p>If the underlying stream has a read timeout, {@link #readFrame()} lets the
 * resulting {@link InterruptedIOException} (typically
 * {@code SocketTimeoutException}) propagate. Bytes already accumulated are
 * retained, and the next call resumes the same frame. This is what allows a
 * receive loop to poll a stop flag between timed reads without losing
 * stream alignment.</p>
 *
 * <h2>End of stream</h2>
 * <p>A read returning end-of-stream, whether at a frame boundary or in the
 * middle of a frame, is a peer disconnect and is reported as
 * {@link EOFException}.</p>
 *
 * <p>Instances are not thread-safe; one receive loop owns one reader.</p>
 */
public final class LengthPrefixFrameReader
{
    private final InputStream in;
    private final int maxFrameLength;

    private final byte[] header = new byte[LengthPrefixFraming.HEADER_LENGTH];
    private int headerFilled;

    private byte[] body;
    private int bodyFilled;

    public LengthPrefixFrameReader(InputStream in)
    {
        this(in, LengthPrefixFraming.DEFAULT_MAX_FRAME_LENGTH);
    }

    public LengthPrefixFrameReader(InputStream in, int maxFrameLength)
    {
        this.in = Objects.requireNonNull(in, "in");
        if (maxFrameLength <= 0) {
            throw new IllegalArgumentException("maxFrameLength must be positive");
        }
        this.maxFrameLength = maxFrameLength;
    }

    /**
     * Block until one complete frame body is available.
     *
     * @return the frame body, without its length prefix
     * @throws EOFException            if the peer closed the stream
     * @throws FrameTooLargeException  if the prefix exceeds the configured maximum
     * @throws InterruptedIOException  if the stream's read timeout elapsed; the
     *                                 partial frame is kept for the next call
     * @throws IOException             on any other I/O failure
     */
    public byte[] readFrame() throws IOException
    {
        while (headerFilled < header.length) {
            int n = in.read(header, headerFilled, header.length - headerFilled);
            if (n < 0) {
                throw new EOFException(headerFilled == 0
                        ? "Peer closed the stream"
                        : "Peer closed the stream inside a length prefix");
            }
            headerFilled += n;
        }

        if (body == null) {
            long length = LengthPrefixFraming.readLength(header);
            if (length > maxFrameLength) {
                throw new FrameTooLargeException(length, maxFrameLength);
            }
            body = new byte[(int) length];
            bodyFilled = 0;
        }

        while (bodyFilled < body.length) {
            int n = in.read(body, bodyFilled, body.length - bodyFilled);
            if (n < 0) {
                throw new EOFException("Peer closed the stream after " + bodyFilled
                        + " of " + body.length + " frame bytes");
            }
            bodyFilled += n;
        }

        byte[] frame = body;
        body = null;
        bodyFilled = 0;
        headerFilled = 0;
        return frame;
    }
}
