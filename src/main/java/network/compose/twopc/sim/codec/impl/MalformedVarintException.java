package network.compose.twopc.sim.codec.impl;

import network.compose.twopc.sim.codec.DecodeError;

final class MalformedVarintException extends WireFormatException
{
    MalformedVarintException(String message) {
        super(DecodeError.Kind.MALFORMED_VARINT, message);
    }
}
