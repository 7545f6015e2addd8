package network.compose.twopc.sim.observability;

import java.time.Instant;

/**
 * Record representing an error in a participant or its connection.
 */
public record ParticipantErrorEvent(
    Instant timestamp,
    String participantId,
    String message,
    Throwable cause
) {
}
