package network.compose.twopc.sim.codec.impl;

import network.compose.twopc.sim.codec.DecodeError;

final class TruncatedMessageException extends WireFormatException
{
    TruncatedMessageException(String message) {
        super(DecodeError.Kind.TRUNCATED_MESSAGE, message);
    }
}
