package network.compose.twopc.sim.runtime;

import network.compose.twopc.sim.config.SimulationConfig;
import network.compose.twopc.sim.observability.Slf4jParticipantObservabilitySink;
import network.compose.twopc.sim.participant.ParticipantCounters;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point. See {@link SimulationConfig#USAGE} for the flags.
 *
 * <p>Exit status is 0 after a completed run (or {@code --help}), 2 on invalid
 * arguments, and 1 if no participant managed to connect.</p>
 */
public final class SimulatorMain {
    private static final Logger log = LoggerFactory.getLogger(SimulatorMain.class);

    private SimulatorMain() {}

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (SimulationConfig.isHelpRequested(args)) {
            System.out.println(SimulationConfig.USAGE);
            return 0;
        }

        SimulationConfig config;
        try {
            config = SimulationConfig.parse(args);
        } catch (IllegalArgumentException ex) {
            log.error("Invalid arguments: {}", ex.getMessage());
            System.err.println(SimulationConfig.USAGE);
            return 2;
        }

        log.info("Starting 2PC participant simulation with {} clients against {}:{}",
            config.clients(), config.host(), config.port());
        log.info("Vote strategy: {}{}, duration: {}s, transport: {}",
            config.voteStrategy(),
            config.strategyOverrides().isEmpty() ? "" : " (overrides " + config.strategyOverrides() + ")",
            config.duration().toSeconds(),
            config.transport());

        SimulationReport report;
        try {
            report = SimulationHarness.builder()
                .withConfig(config)
                .withObservabilitySink(new Slf4jParticipantObservabilitySink())
                .build()
                .run();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted; simulation stopped early");
            return 1;
        }

        for (SimulationReport.ParticipantReport p : report.participants()) {
            ParticipantCounters c = p.counters();
            log.info("{} ({}, {}): connected={} proposals={} votes={} commits={} aborts={} blocks={} decodeErrors={}",
                p.clientId(), p.chainId().toHex(), p.strategy(), p.connected(),
                c.proposalsSeen(), c.votesSent(), c.commits(), c.aborts(), c.blocksSent(), c.decodeErrors());
        }

        return report.connectedCount() > 0 ? 0 : 1;
    }
}
