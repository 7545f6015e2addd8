package network.compose.twopc.sim.runtime;

import network.compose.twopc.sim.config.SimulationConfig;
import network.compose.twopc.sim.internal.time.DurationRange;
import network.compose.twopc.sim.internal.time.MonotonicClock;
import network.compose.twopc.sim.internal.time.ScheduledExecutorScheduler;
import network.compose.twopc.sim.internal.time.SystemMonotonicClock;
import network.compose.twopc.sim.observability.NullObservabilitySink;
import network.compose.twopc.sim.observability.ParticipantObservabilitySink;
import network.compose.twopc.sim.participant.ParticipantIdentity;
import network.compose.twopc.sim.participant.ParticipantRoster;
import network.compose.twopc.sim.participant.SequencerParticipant;
import network.compose.twopc.sim.policy.FallbackVotePolicy;
import network.compose.twopc.sim.policy.VotePolicy;
import network.compose.twopc.sim.policy.VoteStrategy;
import network.compose.twopc.sim.policy.VoteTiming;
import network.compose.twopc.sim.transport.StreamEndpoint;
import network.compose.twopc.sim.transport.tcp.SocketStreamEndpoint;
import network.compose.twopc.sim.transport.tcp.netty.NettyTcpStreamEndpoint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * SimulationHarness
 * =============================================================================
 * Composition root for one simulation run.
 *
 * <h2>Run sequence</h2>
 * <ol>
 *   <li>Build and connect each participant in index order, pausing for the
 *       connection stagger between attempts. A participant that fails to
 *       connect is reported and the run continues without it.</li>
 *   <li>If origination is requested, participant 0 originates
 *       {@code txCount} proposals, each after a randomized spacing delay.</li>
 *   <li>Wait for the configured duration, or until every participant has
 *       stopped.</li>
 *   <li>Stop every participant, wait a bounded time for each receive side,
 *       force-close the stragglers and shut the schedulers down. Delayed sends
 *       still pending at that point are abandoned.</li>
 * </ol>
 *
 * <h2>Ownership</h2>
 * Each participant gets its own single-threaded scheduler, its own endpoint and
 * its own {@link Random}. Nothing is shared between participants.
 */
public final class SimulationHarness {
    private static final Logger log = LoggerFactory.getLogger(SimulationHarness.class);

    private static final Duration POLL_INTERVAL = Duration.ofMillis(100);

    private final SimulationConfig config;
    private final ParticipantObservabilitySink observabilitySink;
    private final EndpointFactory endpointFactory;
    private final MonotonicClock clock;

    /**
     * Creates the transport for one participant.
     */
    @FunctionalInterface
    public interface EndpointFactory {
        StreamEndpoint create(ParticipantIdentity identity, SimulationConfig config);
    }

    private SimulationHarness(Builder b) {
        this.config = b.config;
        this.observabilitySink = b.observabilitySink;
        this.endpointFactory = b.endpointFactory;
        this.clock = b.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Execute the run and block until it is over.
     *
     * @throws InterruptedException if the calling thread is interrupted; the
     *                              participants started so far are shut down first
     */
    public SimulationReport run() throws InterruptedException {
        long startedAt = clock.nowNanos();
        Random seeds = config.seed().isPresent() ? new Random(config.seed().getAsLong()) : new Random();

        List<Slot> slots = new ArrayList<>(config.clients());
        try {
            for (int i = 0; i < config.clients(); i++) {
                if (i > 0 && !config.connectStagger().isZero()) {
                    Thread.sleep(config.connectStagger().toMillis());
                }
                slots.add(launch(i, new Random(seeds.nextLong())));
            }

            awaitEnd(startedAt, slots);
            for (Slot slot : slots) {
                slot.runningAtEnd = slot.participant.isRunning();
            }
        }
        finally {
            shutdown(slots);
        }

        List<SimulationReport.ParticipantReport> reports = new ArrayList<>(slots.size());
        for (Slot slot : slots) {
            SequencerParticipant p = slot.participant;
            reports.add(new SimulationReport.ParticipantReport(
                p.identity().clientId(),
                p.identity().chainId(),
                slot.strategy,
                p.hasConnected(),
                slot.runningAtEnd,
                p.counters()));
        }

        SimulationReport report = new SimulationReport(Duration.ofNanos(clock.nowNanos() - startedAt), reports);
        log.info("Simulation finished: {}/{} participants connected, totals {}",
            report.connectedCount(), reports.size(), report.totals());
        return report;
    }

    private Slot launch(int index, Random random) {
        ParticipantIdentity identity = ParticipantRoster.identityFor(index);
        VoteStrategy strategy = config.strategyFor(index);

        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, identity.clientId() + "-scheduler");
            t.setDaemon(true);
            return t;
        });

        // Drawn before start(): afterwards the scheduler thread owns the Random.
        LaunchPlan plan = LaunchPlan.draw(index, strategy, config, random);

        SequencerParticipant participant = SequencerParticipant.builder()
            .withIdentity(identity)
            .withEndpoint(endpointFactory.create(identity, config))
            .withVotePolicy(plan.votePolicy())
            .withScheduler(new ScheduledExecutorScheduler(executor, clock))
            .withClock(clock)
            .withRandom(random)
            .withBlockSettle(config.blockSettle())
            .withObservabilitySink(observabilitySink)
            .build();

        log.info("Starting {} with strategy {}", identity, strategy);
        if (!participant.start()) {
            log.warn("{} could not connect to {}:{}; continuing without it", identity.clientId(), config.host(), config.port());
        }
        else {
            plan.originations().forEach(participant::originate);
        }

        return new Slot(participant, strategy, executor);
    }

    private void awaitEnd(long startedAt, List<Slot> slots) throws InterruptedException {
        long deadline = startedAt + config.duration().toNanos();
        while (true) {
            long remaining = deadline - clock.nowNanos();
            if (remaining <= 0) {
                return;
            }
            if (allStopped(slots)) {
                log.info("All participants stopped before the run duration elapsed");
                return;
            }
            Thread.sleep(Math.max(1, Math.min(TimeUnit.NANOSECONDS.toMillis(remaining), POLL_INTERVAL.toMillis())));
        }
    }

    private static boolean allStopped(List<Slot> slots) {
        for (Slot slot : slots) {
            if (slot.participant.isRunning()) {
                return false;
            }
        }
        return true;
    }

    private void shutdown(List<Slot> slots) throws InterruptedException {
        for (Slot slot : slots) {
            slot.participant.stop();
        }
        for (Slot slot : slots) {
            if (!slot.participant.awaitStopped(config.joinTimeout())) {
                log.warn("{} did not stop within {}; closing its connection", slot.participant.identity().clientId(),
                    config.joinTimeout());
                slot.participant.forceClose();
            }
            slot.executor.shutdownNow();
        }
    }

    private static StreamEndpoint defaultEndpoint(ParticipantIdentity identity, SimulationConfig config) {
        InetSocketAddress remote = new InetSocketAddress(config.host(), config.port());
        return switch (config.transport()) {
            case SOCKET -> new SocketStreamEndpoint(identity.clientId(), remote, config.connectTimeout(), config.readTimeout());
            case NETTY -> new NettyTcpStreamEndpoint(identity.clientId(), remote, config.connectTimeout());
        };
    }

    /**
     * The random draws for one participant, made on the harness thread.
     *
     * @param baseDelay    vote delay used by the strategy and by its fallback
     * @param originations cumulative origination offsets, empty unless this
     *                     participant is the initiator
     */
    record LaunchPlan(Duration baseDelay, VotePolicy votePolicy, List<Duration> originations) {

        LaunchPlan {
            originations = List.copyOf(originations);
        }

        static LaunchPlan draw(int index, VoteStrategy strategy, SimulationConfig config, Random random) {
            Duration baseDelay = config.voteTiming().base().sample(random);
            VoteTiming timing = new VoteTiming(DurationRange.fixed(baseDelay), config.voteTiming().late());
            VotePolicy policy = new FallbackVotePolicy(VotePolicy.forStrategy(strategy, timing, random), baseDelay);

            List<Duration> originations = new ArrayList<>();
            if (index == 0 && config.sendTx()) {
                Duration at = Duration.ZERO;
                for (int k = 0; k < config.txCount(); k++) {
                    at = at.plus(config.originationSpacing().sample(random));
                    originations.add(at);
                }
            }
            return new LaunchPlan(baseDelay, policy, originations);
        }
    }

    private static final class Slot {
        final SequencerParticipant participant;
        final VoteStrategy strategy;
        final ScheduledExecutorService executor;
        boolean runningAtEnd;

        Slot(SequencerParticipant participant, VoteStrategy strategy, ScheduledExecutorService executor) {
            this.participant = participant;
            this.strategy = strategy;
            this.executor = executor;
        }
    }

    public static final class Builder {
        private SimulationConfig config = SimulationConfig.builder().build();
        private ParticipantObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private EndpointFactory endpointFactory = SimulationHarness::defaultEndpoint;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;

        public Builder withConfig(SimulationConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(ParticipantObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withEndpointFactory(EndpointFactory factory) {
            this.endpointFactory = factory;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public SimulationHarness build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(endpointFactory, "endpointFactory");
            Objects.requireNonNull(clock, "clock");
            return new SimulationHarness(this);
        }
    }
}
