package network.compose.twopc.sim.model;

import java.util.Objects;

/**
 * Canonical semantic representation of one coordinator protocol message.
 *
 * <h2>Purpose</h2>
 * <p>
 * A {@code Message} is the envelope exchanged between a sequencer and the
 * coordinator: the sender's client id plus exactly one payload variant. It is
 * the only form of message the participant state machine reasons about.
 * </p>
 *
 * <p>
 * Wire concerns (field tags, varints, length prefixes) are resolved strictly
 * below this layer, in the codec, before a {@code Message} is created.
 * </p>
 *
 * @param senderId client id of the sending party (may be empty, never null)
 * @param payload  the single payload variant carried by this message
 */
public record Message(
        String senderId,
        MessagePayload payload
) {
    public Message {
        Objects.requireNonNull(senderId, "senderId");
        Objects.requireNonNull(payload, "payload");
    }
}
