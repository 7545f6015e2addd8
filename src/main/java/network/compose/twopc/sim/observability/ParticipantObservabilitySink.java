package network.compose.twopc.sim.observability;

/**
 * Receives participant observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Calls arrive from participant scheduler threads and transport threads.
 * Implementations must be thread-safe and must not block.</p>
 */
public interface ParticipantObservabilitySink {
    /**
     * Called when a participant connects, exchanges a protocol message, or
     * disconnects.
     * @param event the lifecycle event
     */
    void onLifecycleEvent(ParticipantLifecycleEvent event);

    /**
     * Called when an inbound frame could not be decoded and was discarded.
     * @param event the rejected frame details
     */
    void onDecodeError(DecodeErrorEvent event);

    /**
     * Called when an error stops a participant or a send fails.
     * @param event the error event
     */
    void onError(ParticipantErrorEvent event);
}
