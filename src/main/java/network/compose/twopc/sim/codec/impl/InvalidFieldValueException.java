package network.compose.twopc.sim.codec.impl;

import network.compose.twopc.sim.codec.DecodeError;

final class InvalidFieldValueException extends WireFormatException
{
    InvalidFieldValueException(String message) {
        super(DecodeError.Kind.INVALID_FIELD_VALUE, message);
    }
}
