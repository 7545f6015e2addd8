package network.compose.twopc.sim.codec;

import java.util.Objects;

/**
 * Why a frame could not be decoded.
 *
 * @param kind   failure class
 * @param detail human-readable diagnostic
 */
public record DecodeError(
        Kind kind,
        String detail
) {
    public DecodeError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(detail, "detail");
    }

    public enum Kind {
        /** The buffer ended inside a varint, or a varint ran past 10 bytes. */
        MALFORMED_VARINT,
        /** A declared length exceeds the bytes remaining in the buffer. */
        TRUNCATED_MESSAGE,
        /** A tag carried a wire type this protocol cannot skip. */
        INVALID_WIRE_TYPE,
        /** The envelope carried no payload variant. */
        MISSING_PAYLOAD,
        /** A field value is outside its domain (xt_id above 2^32-1, empty chain id). */
        INVALID_FIELD_VALUE
    }
}
