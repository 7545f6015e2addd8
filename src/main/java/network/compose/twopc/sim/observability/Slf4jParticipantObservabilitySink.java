package network.compose.twopc.sim.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ParticipantObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jParticipantObservabilitySink implements ParticipantObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jParticipantObservabilitySink.class);

    @Override
    public void onLifecycleEvent(ParticipantLifecycleEvent event) {
        String id = event.participantId();
        switch (event.kind()) {
            case CONNECTED -> log.info("[{}] Connected", id);
            case PROPOSAL_RECEIVED -> log.info("[{}] Received XTRequest, tracking as xt_id={}", id, event.xtId());
            case PROPOSAL_SENT -> log.info("[{}] Sent XTRequest, tracking as xt_id={}", id, event.xtId());
            case VOTE_SENT -> log.info("[{}] Sent Vote: {} for xt_id={}", id, verdict(event.commit()), event.xtId());
            case DECISION_RECEIVED ->
                log.info("[{}] Received Decided: {} for xt_id={}", id, verdict(event.commit()), event.xtId());
            case BLOCK_SENT -> log.info("[{}] Sent Block with xt_id={}", id, event.xtId());
            case DISCONNECTED -> log.info("[{}] Disconnected", id);
        }
    }

    @Override
    public void onDecodeError(DecodeErrorEvent event) {
        log.warn("[{}] Discarded {}-byte frame: {} ({})",
            event.participantId(),
            event.frameLength(),
            event.error().kind(),
            event.error().detail());
    }

    @Override
    public void onError(ParticipantErrorEvent event) {
        log.error("[{}] {}", event.participantId(), event.message(), event.cause());
    }

    private static String verdict(Boolean commit) {
        return Boolean.TRUE.equals(commit) ? "COMMIT" : "ABORT";
    }
}
