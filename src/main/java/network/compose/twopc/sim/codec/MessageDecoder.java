package network.compose.twopc.sim.codec;

/**
 * MessageDecoder
 * -----------------------------------------------------------------------------
 * Inbound boundary between one complete frame body and a semantic
 * {@code Message}.
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Walking the tag/value pairs of the envelope and its nested payload</li>
 *   <li>Skipping fields it does not recognise</li>
 *   <li>Detecting truncation and malformed varints</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Stream framing or accumulation of partial reads</li>
 *   <li>Interpreting protocol semantics</li>
 * </ul>
 *
 * <p>Malformed input is never signalled by an exception. Every failure is
 * reported as a {@link DecodeResult.Rejected} so that callers can drop the
 * frame and keep the connection.</p>
 */
public interface MessageDecoder
{
    /**
     * Decode a single message from a complete frame body.
     *
     * @param frame bytes of exactly one message, without the length prefix
     * @return {@link DecodeResult.Decoded} on success,
     *         {@link DecodeResult.Rejected} if the bytes are malformed
     */
    DecodeResult decode(byte[] frame);
}
