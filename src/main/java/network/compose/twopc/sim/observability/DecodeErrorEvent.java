package network.compose.twopc.sim.observability;

import network.compose.twopc.sim.codec.DecodeError;

import java.time.Instant;

/**
 * Record representing an inbound frame that was rejected by the decoder.
 */
public record DecodeErrorEvent(
    Instant timestamp,
    String participantId,
    int frameLength,
    DecodeError error
) {
}
