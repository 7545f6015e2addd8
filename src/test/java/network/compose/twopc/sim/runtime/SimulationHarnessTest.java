package network.compose.twopc.sim.runtime;

import network.compose.twopc.sim.config.SimulationConfig;
import network.compose.twopc.sim.config.TransportKind;
import network.compose.twopc.sim.internal.time.DurationRange;
import network.compose.twopc.sim.model.Block;
import network.compose.twopc.sim.model.ChainId;
import network.compose.twopc.sim.model.Decided;
import network.compose.twopc.sim.model.Message;
import network.compose.twopc.sim.model.Vote;
import network.compose.twopc.sim.model.XTRequest;
import network.compose.twopc.sim.model.XtId;
import network.compose.twopc.sim.observability.ParticipantLifecycleEvent.Kind;
import network.compose.twopc.sim.observability.RecordingObservabilitySink;
import network.compose.twopc.sim.participant.ParticipantCounters;
import network.compose.twopc.sim.participant.ParticipantRoster;
import network.compose.twopc.sim.policy.FallbackVotePolicy;
import network.compose.twopc.sim.policy.VoteStrategy;
import network.compose.twopc.sim.policy.VoteTiming;
import network.compose.twopc.sim.transport.FakeCoordinator;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SimulationHarnessTest
 * -----------------------------------------------------------------------------
 * Runs whole simulations against a loopback coordinator with shortened timings.
 */
class SimulationHarnessTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private FakeCoordinator coordinator;
    private ExecutorService runner;

    @BeforeEach
    void setUp() throws IOException {
        coordinator = new FakeCoordinator();
        runner = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() throws IOException {
        runner.shutdownNow();
        coordinator.close();
    }

    private SimulationConfig.Builder fastConfig(int port) {
        return SimulationConfig.builder()
            .withHost("127.0.0.1")
            .withPort(port)
            .withClients(3)
            .withVoteStrategy(VoteStrategy.COMMIT)
            .withConnectStagger(Duration.ofMillis(20))
            .withReadTimeout(Duration.ofMillis(100))
            .withJoinTimeout(Duration.ofSeconds(1))
            .withVoteTiming(new VoteTiming(DurationRange.ofMillis(20, 60), DurationRange.fixed(Duration.ofMillis(300))))
            .withBlockSettle(DurationRange.fixed(Duration.ofMillis(30)))
            .withOriginationSpacing(DurationRange.fixed(Duration.ofMillis(100)))
            .withSeed(42L);
    }

    // ---------------------------------------------------------------------
    // Full round
    // ---------------------------------------------------------------------

    @Test
    void threeCommittingParticipantsVoteAndSubmitBlocks() throws Exception {
        runFullRound(TransportKind.SOCKET);
    }

    @Test
    void fullRoundOverNettyTransport() throws Exception {
        runFullRound(TransportKind.NETTY);
    }

    private void runFullRound(TransportKind transport) throws Exception {
        SimulationConfig config = fastConfig(coordinator.port())
            .withSendTx(true)
            .withTxCount(1)
            .withDuration(Duration.ofSeconds(3))
            .withTransport(transport)
            .build();
        RecordingObservabilitySink sink = new RecordingObservabilitySink();

        Future<SimulationReport> result = runner.submit(() -> SimulationHarness.builder()
            .withConfig(config)
            .withObservabilitySink(sink)
            .build()
            .run());

        assertTrue(coordinator.awaitConnections(3, WAIT));
        assertTrue(coordinator.awaitReceived(r -> votes(r).size() == 3, WAIT));

        List<Message> received = coordinator.received();
        assertEquals(1, received.stream().filter(m -> m.payload() instanceof XTRequest).count());
        assertEquals("sequencer-A", received.stream()
            .filter(m -> m.payload() instanceof XTRequest).findFirst().orElseThrow().senderId());
        for (Vote vote : votes(received)) {
            assertEquals(XtId.of(1), vote.xtId());
            assertTrue(vote.commit());
        }
        Set<ChainId> voters = votes(received).stream().map(Vote::senderChainId).collect(Collectors.toSet());
        assertEquals(Set.of(ParticipantRoster.chainIdFor(0), ParticipantRoster.chainIdFor(1),
            ParticipantRoster.chainIdFor(2)), voters);

        coordinator.broadcast(new Message("publisher", new Decided(XtId.of(1), true)));
        assertTrue(coordinator.awaitReceived(r -> blocks(r).size() == 3, WAIT));
        for (Block block : blocks(coordinator.received())) {
            assertEquals(List.of(XtId.of(1)), block.includedXtIds());
        }

        SimulationReport report = result.get(10, TimeUnit.SECONDS);
        assertEquals(3, report.connectedCount());
        assertEquals(List.of("sequencer-A", "sequencer-B", "sequencer-C"),
            report.participants().stream().map(SimulationReport.ParticipantReport::clientId).collect(Collectors.toList()));

        ParticipantCounters totals = report.totals();
        assertEquals(1, totals.proposalsSent());
        assertEquals(2, totals.proposalsReceived());
        assertEquals(3, totals.votesSent());
        assertEquals(3, totals.commits());
        assertEquals(3, totals.blocksSent());
        assertEquals(0, totals.decodeErrors());

        assertEquals(3, sink.lifecycle(Kind.CONNECTED).size());
        assertEquals(3, sink.lifecycle(Kind.BLOCK_SENT).size());
        assertEquals(List.of(Kind.CONNECTED, Kind.PROPOSAL_RECEIVED, Kind.VOTE_SENT, Kind.DECISION_RECEIVED,
            Kind.BLOCK_SENT, Kind.DISCONNECTED), sink.lifecycleOf("sequencer-B"));
    }

    @Test
    void perParticipantStrategiesShapeTheVotes() throws Exception {
        SimulationConfig config = fastConfig(coordinator.port())
            .withStrategyOverrides(List.of(VoteStrategy.COMMIT, VoteStrategy.ABORT))
            .withSendTx(true)
            .withDuration(Duration.ofSeconds(2))
            .build();

        Future<SimulationReport> result = runner.submit(() -> SimulationHarness.builder().withConfig(config).build().run());

        assertTrue(coordinator.awaitReceived(r -> votes(r).size() == 3, WAIT));
        for (Vote vote : votes(coordinator.received())) {
            boolean expected = !vote.senderChainId().equals(ParticipantRoster.chainIdFor(1));
            assertEquals(expected, vote.commit(), "vote from " + vote.senderChainId());
        }

        coordinator.broadcast(new Message("publisher", new Decided(XtId.of(1), false)));

        SimulationReport report = result.get(10, TimeUnit.SECONDS);
        assertEquals(List.of(VoteStrategy.COMMIT, VoteStrategy.ABORT, VoteStrategy.COMMIT),
            report.participants().stream().map(SimulationReport.ParticipantReport::strategy).collect(Collectors.toList()));
        assertEquals(3, report.totals().aborts());
        assertEquals(0, report.totals().blocksSent());
    }

    // ---------------------------------------------------------------------
    // Per-participant draws
    // ---------------------------------------------------------------------

    @Test
    void strategyAndFallbackShareOneBaseDelay() {
        SimulationConfig config = SimulationConfig.builder()
            .withVoteTiming(new VoteTiming(DurationRange.ofMillis(500, 2_000), DurationRange.ofMillis(3_000, 6_000)))
            .build();

        for (VoteStrategy strategy : List.of(VoteStrategy.COMMIT, VoteStrategy.ABORT, VoteStrategy.RANDOM)) {
            SimulationHarness.LaunchPlan plan = SimulationHarness.LaunchPlan.draw(1, strategy, config, new Random(99));

            FallbackVotePolicy policy = assertInstanceOf(FallbackVotePolicy.class, plan.votePolicy());
            assertEquals(plan.baseDelay(), policy.fallbackDelay());
            assertEquals(plan.baseDelay(), policy.decide(XtId.of(1)).delay());
            assertEquals(plan.baseDelay(), policy.decide(XtId.of(2)).delay());
        }
    }

    @Test
    void sameSeedDrawsSamePlan() {
        SimulationConfig config = SimulationConfig.builder()
            .withSendTx(true)
            .withTxCount(3)
            .build();

        SimulationHarness.LaunchPlan first = SimulationHarness.LaunchPlan.draw(0, VoteStrategy.RANDOM, config, new Random(17));
        SimulationHarness.LaunchPlan second = SimulationHarness.LaunchPlan.draw(0, VoteStrategy.RANDOM, config, new Random(17));

        assertEquals(first.baseDelay(), second.baseDelay());
        assertEquals(first.originations(), second.originations());
        for (long id = 1; id <= 5; id++) {
            assertEquals(first.votePolicy().decide(XtId.of(id)), second.votePolicy().decide(XtId.of(id)));
        }
    }

    @Test
    void onlyTheInitiatorGetsOriginationOffsets() {
        SimulationConfig config = SimulationConfig.builder()
            .withSendTx(true)
            .withTxCount(3)
            .withOriginationSpacing(DurationRange.ofMillis(1_000, 3_000))
            .build();

        List<Duration> offsets = SimulationHarness.LaunchPlan.draw(0, VoteStrategy.COMMIT, config, new Random(4)).originations();
        assertEquals(3, offsets.size());
        Duration previous = Duration.ZERO;
        for (Duration at : offsets) {
            Duration gap = at.minus(previous);
            assertTrue(gap.compareTo(Duration.ofMillis(1_000)) >= 0 && gap.compareTo(Duration.ofMillis(3_000)) <= 0, gap::toString);
            previous = at;
        }

        assertTrue(SimulationHarness.LaunchPlan.draw(1, VoteStrategy.COMMIT, config, new Random(4)).originations().isEmpty());
        assertTrue(SimulationHarness.LaunchPlan.draw(0, VoteStrategy.COMMIT,
            SimulationConfig.builder().withTxCount(3).build(), new Random(4)).originations().isEmpty());
    }

    // ---------------------------------------------------------------------
    // Early exits
    // ---------------------------------------------------------------------

    @Test
    void runEndsEarlyWhenCoordinatorDropsEveryone() throws Exception {
        SimulationConfig config = fastConfig(coordinator.port())
            .withClients(2)
            .withDuration(Duration.ofSeconds(60))
            .build();

        Future<SimulationReport> result = runner.submit(() -> SimulationHarness.builder().withConfig(config).build().run());

        assertTrue(coordinator.awaitConnections(2, WAIT));
        Thread.sleep(200);
        coordinator.closeConnection(0);
        coordinator.closeConnection(1);

        SimulationReport report = result.get(10, TimeUnit.SECONDS);
        assertTrue(report.elapsed().compareTo(Duration.ofSeconds(10)) < 0);
        assertEquals(2, report.connectedCount());
        assertTrue(report.participants().stream().noneMatch(SimulationReport.ParticipantReport::running));
    }

    @Test
    void unreachableCoordinatorYieldsNoConnections() throws Exception {
        int closedPort;
        try (ServerSocket probe = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            closedPort = probe.getLocalPort();
        }
        SimulationConfig config = fastConfig(closedPort)
            .withClients(2)
            .withSendTx(true)
            .withDuration(Duration.ofSeconds(60))
            .build();
        RecordingObservabilitySink sink = new RecordingObservabilitySink();

        SimulationReport report = runner.submit(() -> SimulationHarness.builder()
            .withConfig(config)
            .withObservabilitySink(sink)
            .build()
            .run()).get(10, TimeUnit.SECONDS);

        assertEquals(0, report.connectedCount());
        assertEquals(2, report.participants().size());
        assertEquals(ParticipantCounters.ZERO, report.totals());
        assertTrue(sink.lifecycle(Kind.CONNECTED).isEmpty());
    }

    private static List<Vote> votes(List<Message> messages) {
        return messages.stream()
            .filter(m -> m.payload() instanceof Vote)
            .map(m -> (Vote) m.payload())
            .collect(Collectors.toList());
    }

    private static List<Block> blocks(List<Message> messages) {
        return messages.stream()
            .filter(m -> m.payload() instanceof Block)
            .map(m -> (Block) m.payload())
            .collect(Collectors.toList());
    }
}
