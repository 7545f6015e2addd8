package network.compose.twopc.sim.participant;

import network.compose.twopc.sim.codec.DecodeResult;
import network.compose.twopc.sim.codec.MessageDecoder;
import network.compose.twopc.sim.codec.MessageEncoder;
import network.compose.twopc.sim.codec.impl.DefaultMessageDecoder;
import network.compose.twopc.sim.codec.impl.DefaultMessageEncoder;
import network.compose.twopc.sim.internal.state.PendingTransaction;
import network.compose.twopc.sim.internal.state.TransactionLedger;
import network.compose.twopc.sim.internal.state.TransactionPhase;
import network.compose.twopc.sim.internal.time.DurationRange;
import network.compose.twopc.sim.internal.time.MonotonicClock;
import network.compose.twopc.sim.internal.time.MonotonicScheduler;
import network.compose.twopc.sim.internal.time.SystemMonotonicClock;
import network.compose.twopc.sim.internal.time.SystemWallClock;
import network.compose.twopc.sim.internal.time.WallClock;
import network.compose.twopc.sim.model.Block;
import network.compose.twopc.sim.model.ByteSequence;
import network.compose.twopc.sim.model.Decided;
import network.compose.twopc.sim.model.Message;
import network.compose.twopc.sim.model.MessagePayload;
import network.compose.twopc.sim.model.Vote;
import network.compose.twopc.sim.model.XTRequest;
import network.compose.twopc.sim.model.XtId;
import network.compose.twopc.sim.observability.DecodeErrorEvent;
import network.compose.twopc.sim.observability.NullObservabilitySink;
import network.compose.twopc.sim.observability.ParticipantErrorEvent;
import network.compose.twopc.sim.observability.ParticipantLifecycleEvent;
import network.compose.twopc.sim.observability.ParticipantLifecycleEvent.Kind;
import network.compose.twopc.sim.observability.ParticipantObservabilitySink;
import network.compose.twopc.sim.policy.VoteDecision;
import network.compose.twopc.sim.policy.VotePolicy;
import network.compose.twopc.sim.transport.StreamEndpoint;
import network.compose.twopc.sim.transport.StreamEndpointListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Random;

/**
 * SequencerParticipant
 * =============================================================================
 * One simulated chain sequencer taking part in the coordinator's two-phase
 * commit.
 *
 * <h2>Protocol behaviour</h2>
 * <ul>
 *   <li><b>XTRequest</b>: infer the next xt_id, open a {@code VOTING} entry and
 *       send the policy's vote after the policy's delay.</li>
 *   <li><b>Decided(commit)</b>: mark the entry {@code COMMITTED} and send a
 *       {@link Block} naming the xt_id after a settle delay.</li>
 *   <li><b>Decided(abort)</b>: drop the entry; nothing further is sent.</li>
 *   <li>Anything else is logged and ignored.</li>
 * </ul>
 * A vote is sent once its delay elapses even if the decision arrived first.
 * Late votes are the point of the {@code DELAY} strategy.
 *
 * <h2>Threading</h2>
 * Every state change and every send runs on the participant's
 * {@link MonotonicScheduler}. Inbound frames are handed to it before they are
 * decoded, so the ledger needs no locks and writes to the connection are
 * serialized. {@link #state()}, {@link #isRunning()} and {@link #counters()}
 * may be read from any thread.
 *
 * <h2>Failure</h2>
 * Undecodable frames are reported and dropped. Connection loss or a failed
 * send stops the participant for good; there is no reconnect.
 */
public final class SequencerParticipant implements StreamEndpointListener
{
    private static final Logger log = LoggerFactory.getLogger(SequencerParticipant.class);

    private final ParticipantIdentity identity;
    private final StreamEndpoint endpoint;
    private final VotePolicy votePolicy;
    private final MessageEncoder encoder;
    private final MessageDecoder decoder;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final Random random;
    private final DurationRange blockSettle;
    private final ParticipantObservabilitySink sink;

    private final TransactionLedger ledger = new TransactionLedger();
    private final ParticipantStats stats = new ParticipantStats();

    private volatile TransactionPhase state = TransactionPhase.IDLE;
    private volatile boolean running;
    private volatile boolean connected;

    private SequencerParticipant(Builder b) {
        this.identity = b.identity;
        this.endpoint = b.endpoint;
        this.votePolicy = b.votePolicy;
        this.encoder = b.encoder;
        this.decoder = b.decoder;
        this.scheduler = b.scheduler;
        this.clock = b.clock;
        this.wallClock = b.wallClock;
        this.random = b.random;
        this.blockSettle = b.blockSettle;
        this.sink = b.sink;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * Connect to the coordinator.
     *
     * @return {@code true} if the connection is up
     */
    public boolean start() {
        endpoint.setListener(this);
        endpoint.start();
        return running;
    }

    /**
     * Ask the receive side to stop. Pending delayed sends are not cancelled
     * here; they are dropped once the participant is no longer running.
     */
    public void stop() {
        running = false;
        endpoint.stop();
    }

    /**
     * Wait up to {@code timeout} for the receive side to finish.
     */
    public boolean awaitStopped(Duration timeout) throws InterruptedException {
        return endpoint.awaitStopped(timeout);
    }

    /**
     * Close the connection without waiting for the receive side.
     */
    public void forceClose() {
        running = false;
        endpoint.forceClose();
    }

    /**
     * Originate the default proposal once {@code delay} has elapsed, then vote
     * on it like any received proposal.
     */
    public void originate(Duration delay) {
        scheduler.scheduleAfter(delay, clock, this::originateNow);
    }

    // ---------------------------------------------------------------------
    // Introspection
    // ---------------------------------------------------------------------

    public ParticipantIdentity identity() {
        return identity;
    }

    /**
     * Phase of the most recent per-transaction transition. Advisory only when
     * proposals overlap.
     */
    public TransactionPhase state() {
        return state;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Whether the connection ever came up.
     */
    public boolean hasConnected() {
        return connected;
    }

    public ParticipantCounters counters() {
        return stats.snapshot();
    }

    // ---------------------------------------------------------------------
    // StreamEndpointListener
    // ---------------------------------------------------------------------

    @Override
    public void onTransportUp() {
        connected = true;
        running = true;
        sink.onLifecycleEvent(ParticipantLifecycleEvent.connection(wallClock.now(), identity.clientId(), Kind.CONNECTED));
    }

    @Override
    public void onTransportDown(Throwable cause) {
        running = false;
        if (!connected) {
            sink.onError(new ParticipantErrorEvent(wallClock.now(), identity.clientId(),
                    "Connection failed", cause));
            return;
        }
        if (cause != null) {
            sink.onError(new ParticipantErrorEvent(wallClock.now(), identity.clientId(),
                    "Connection lost: " + cause.getMessage(), cause));
        }
        sink.onLifecycleEvent(ParticipantLifecycleEvent.connection(wallClock.now(), identity.clientId(), Kind.DISCONNECTED));
    }

    @Override
    public void onFrame(byte[] message) {
        scheduler.execute(clock, () -> handleFrame(message));
    }

    // ---------------------------------------------------------------------
    // Scheduler-confined handlers
    // ---------------------------------------------------------------------

    private void handleFrame(byte[] frame) {
        DecodeResult result = decoder.decode(frame);
        if (result instanceof DecodeResult.Rejected rejected) {
            stats.decodeErrors.incrementAndGet();
            sink.onDecodeError(new DecodeErrorEvent(wallClock.now(), identity.clientId(), frame.length, rejected.error()));
            return;
        }

        Message message = ((DecodeResult.Decoded) result).value();
        MessagePayload payload = message.payload();
        if (payload instanceof XTRequest) {
            onProposal();
        }
        else if (payload instanceof Decided decided) {
            onDecided(decided);
        }
        else {
            log.debug("[{}] Ignoring {} from {}", identity.clientId(), payload.getClass().getSimpleName(), message.senderId());
        }
    }

    private void onProposal() {
        XtId xtId = ledger.nextProposalId();
        stats.proposalsReceived.incrementAndGet();
        sink.onLifecycleEvent(event(Kind.PROPOSAL_RECEIVED, xtId, null));
        beginVoting(xtId);
    }

    private void originateNow() {
        if (!send(DefaultProposal.create())) {
            return;
        }
        XtId xtId = ledger.nextProposalId();
        stats.proposalsSent.incrementAndGet();
        sink.onLifecycleEvent(event(Kind.PROPOSAL_SENT, xtId, null));
        beginVoting(xtId);
    }

    private void beginVoting(XtId xtId) {
        if (!ledger.open(xtId)) {
            log.warn("[{}] xt_id={} already has an outstanding vote; ignoring proposal", identity.clientId(), xtId);
            return;
        }
        state = TransactionPhase.VOTING;

        VoteDecision decision = votePolicy.decide(xtId);
        scheduler.scheduleAfter(decision.delay(), clock, () -> sendVote(xtId, decision.commit()));
    }

    private void sendVote(XtId xtId, boolean commit) {
        if (!send(new Vote(identity.chainId(), xtId, commit))) {
            return;
        }
        ledger.recordVote(xtId, commit);
        stats.votesSent.incrementAndGet();
        sink.onLifecycleEvent(event(Kind.VOTE_SENT, xtId, commit));
    }

    private void onDecided(Decided decided) {
        XtId xtId = decided.xtId();
        PendingTransaction tx = ledger.resolve(xtId, decided.commit()).orElse(null);
        if (tx == null) {
            log.debug("[{}] Decided for xt_id={} has no voting entry; ignoring", identity.clientId(), xtId);
            return;
        }

        state = tx.phase();
        sink.onLifecycleEvent(event(Kind.DECISION_RECEIVED, xtId, decided.commit()));

        if (tx.phase() == TransactionPhase.COMMITTED) {
            stats.commits.incrementAndGet();
            scheduler.scheduleAfter(blockSettle.sample(random), clock, () -> sendBlock(xtId));
        }
        else {
            stats.aborts.incrementAndGet();
        }
    }

    private void sendBlock(XtId xtId) {
        List<XtId> included = List.of(xtId);
        if (send(new Block(identity.chainId(), blockMarker(included.size()), included))) {
            stats.blocksSent.incrementAndGet();
            sink.onLifecycleEvent(event(Kind.BLOCK_SENT, xtId, null));
        }
        ledger.complete(xtId);
    }

    private ByteSequence blockMarker(int transactionCount) {
        double epochSeconds = wallClock.now().toEpochMilli() / 1000.0;
        return ByteSequence.ofUtf8(String.format(Locale.ROOT, "Block from %s at %.2f with %d TXs",
                identity.clientId(), epochSeconds, transactionCount));
    }

    private boolean send(MessagePayload payload) {
        if (!running) {
            log.debug("[{}] Not running; dropping outbound {}", identity.clientId(), payload.getClass().getSimpleName());
            return false;
        }

        byte[] bytes = encoder.encode(new Message(identity.clientId(), payload));
        try {
            endpoint.send(bytes);
            return true;
        }
        catch (IOException e) {
            sink.onError(new ParticipantErrorEvent(wallClock.now(), identity.clientId(),
                    "Failed to send " + payload.getClass().getSimpleName(), e));
            stop();
            return false;
        }
    }

    private ParticipantLifecycleEvent event(Kind kind, XtId xtId, Boolean commit) {
        return new ParticipantLifecycleEvent(wallClock.now(), identity.clientId(), kind, xtId, commit);
    }

    @Override
    public String toString() {
        return "SequencerParticipant[" + identity + ", running=" + running + ", state=" + state + "]";
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static final class Builder {
        private ParticipantIdentity identity;
        private StreamEndpoint endpoint;
        private VotePolicy votePolicy;
        private MonotonicScheduler scheduler;
        private MessageEncoder encoder = new DefaultMessageEncoder();
        private MessageDecoder decoder = new DefaultMessageDecoder();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private Random random = new Random();
        private DurationRange blockSettle = DurationRange.ofMillis(500, 1_500);
        private ParticipantObservabilitySink sink = NullObservabilitySink.INSTANCE;

        public Builder withIdentity(ParticipantIdentity identity) {
            this.identity = identity;
            return this;
        }

        public Builder withEndpoint(StreamEndpoint endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder withVotePolicy(VotePolicy policy) {
            this.votePolicy = policy;
            return this;
        }

        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder withEncoder(MessageEncoder encoder) {
            this.encoder = encoder;
            return this;
        }

        public Builder withDecoder(MessageDecoder decoder) {
            this.decoder = decoder;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public Builder withRandom(Random random) {
            this.random = random;
            return this;
        }

        public Builder withBlockSettle(DurationRange blockSettle) {
            this.blockSettle = blockSettle;
            return this;
        }

        public Builder withObservabilitySink(ParticipantObservabilitySink sink) {
            this.sink = sink;
            return this;
        }

        public SequencerParticipant build() {
            Objects.requireNonNull(identity, "identity");
            Objects.requireNonNull(endpoint, "endpoint");
            Objects.requireNonNull(votePolicy, "votePolicy");
            Objects.requireNonNull(scheduler, "scheduler");
            Objects.requireNonNull(encoder, "encoder");
            Objects.requireNonNull(decoder, "decoder");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(random, "random");
            Objects.requireNonNull(blockSettle, "blockSettle");
            Objects.requireNonNull(sink, "sink");
            return new SequencerParticipant(this);
        }
    }
}
