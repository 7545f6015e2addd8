package network.compose.twopc.sim.observability;

import network.compose.twopc.sim.model.XtId;

import java.time.Instant;
import java.util.Objects;

/**
 * Record representing one step in a participant's life.
 *
 * @param xtId the transaction concerned; {@code null} for connection events
 * @param commit the vote or decision carried; {@code null} where not applicable
 */
public record ParticipantLifecycleEvent(
    Instant timestamp,
    String participantId,
    Kind kind,
    XtId xtId,
    Boolean commit
) {
    public enum Kind {
        CONNECTED,
        PROPOSAL_RECEIVED,
        PROPOSAL_SENT,
        VOTE_SENT,
        DECISION_RECEIVED,
        BLOCK_SENT,
        DISCONNECTED
    }

    public ParticipantLifecycleEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(participantId, "participantId");
        Objects.requireNonNull(kind, "kind");
    }

    public static ParticipantLifecycleEvent connection(Instant timestamp, String participantId, Kind kind) {
        return new ParticipantLifecycleEvent(timestamp, participantId, kind, null, null);
    }
}
