package network.compose.twopc.sim.codec;

import network.compose.twopc.sim.model.Message;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of decoding one frame: either a message or the reason it was dropped.
 */
public sealed interface DecodeResult
        permits DecodeResult.Decoded, DecodeResult.Rejected
{
    static DecodeResult decoded(Message message) {
        return new Decoded(message);
    }

    static DecodeResult rejected(DecodeError.Kind kind, String detail) {
        return new Rejected(new DecodeError(kind, detail));
    }

    /**
     * Returns the decoded message, or empty if the frame was rejected.
     */
    Optional<Message> message();

    record Decoded(Message value) implements DecodeResult {
        public Decoded {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Optional<Message> message() {
            return Optional.of(value);
        }
    }

    record Rejected(DecodeError error) implements DecodeResult {
        public Rejected {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public Optional<Message> message() {
            return Optional.empty();
        }
    }
}
