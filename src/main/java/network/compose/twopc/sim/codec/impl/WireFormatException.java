package network.compose.twopc.sim.codec.impl;

import network.compose.twopc.sim.codec.DecodeError;

/**
 * Raised inside the codec when protocol bytes violate the wire rules.
 *
 * <p>Never escapes {@link DefaultMessageDecoder}; it is converted into a
 * {@link DecodeError} there.</p>
 */
class WireFormatException extends Exception
{
    private final DecodeError.Kind kind;

    WireFormatException(DecodeError.Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    DecodeError.Kind kind() {
        return kind;
    }
}
