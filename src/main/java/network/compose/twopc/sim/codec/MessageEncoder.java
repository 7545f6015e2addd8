package network.compose.twopc.sim.codec;

import network.compose.twopc.sim.model.Message;

/**
 * MessageEncoder
 * -----------------------------------------------------------------------------
 * Outbound boundary between a semantic {@link Message} and its serialized
 * protocol bytes.
 *
 * <p><strong>Layering note:</strong> the returned bytes are the message body
 * only. The 4-byte length prefix used on the stream is applied by the framing
 * layer ({@code LengthPrefixFraming}) or by the transport.</p>
 */
public interface MessageEncoder
{
    /**
     * Serialize {@code message} into protocol bytes.
     *
     * <p>Encoding a well-formed {@link Message} cannot fail.</p>
     */
    byte[] encode(Message message);
}
