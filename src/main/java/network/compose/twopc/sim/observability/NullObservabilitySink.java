package network.compose.twopc.sim.observability;

/**
 * No-op implementation of ParticipantObservabilitySink.
 */
public final class NullObservabilitySink implements ParticipantObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onLifecycleEvent(ParticipantLifecycleEvent event) {}

    @Override
    public void onDecodeError(DecodeErrorEvent event) {}

    @Override
    public void onError(ParticipantErrorEvent event) {}
}
