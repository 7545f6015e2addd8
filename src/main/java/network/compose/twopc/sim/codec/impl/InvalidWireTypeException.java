package network.compose.twopc.sim.codec.impl;

import network.compose.twopc.sim.codec.DecodeError;

final class InvalidWireTypeException extends WireFormatException
{
    InvalidWireTypeException(int fieldNumber, int wireType) {
        super(DecodeError.Kind.INVALID_WIRE_TYPE,
                "Unsupported wire type " + wireType + " on field " + fieldNumber);
    }
}
