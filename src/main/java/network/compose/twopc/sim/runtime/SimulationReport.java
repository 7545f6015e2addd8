package network.compose.twopc.sim.runtime;

import network.compose.twopc.sim.model.ChainId;
import network.compose.twopc.sim.participant.ParticipantCounters;
import network.compose.twopc.sim.policy.VoteStrategy;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one simulation run.
 *
 * @param elapsed      wall time between the first connection attempt and the
 *                     end of shutdown
 * @param participants one entry per participant, in index order
 */
public record SimulationReport(
    Duration elapsed,
    List<ParticipantReport> participants
) {
    public SimulationReport {
        Objects.requireNonNull(elapsed, "elapsed");
        participants = List.copyOf(Objects.requireNonNull(participants, "participants"));
    }

    /**
     * Final view of one participant.
     *
     * @param connected whether its connection ever came up
     * @param running   whether it was still running when the run ended
     */
    public record ParticipantReport(
        String clientId,
        ChainId chainId,
        VoteStrategy strategy,
        boolean connected,
        boolean running,
        ParticipantCounters counters
    ) {
    }

    public long connectedCount() {
        return participants.stream().filter(ParticipantReport::connected).count();
    }

    /**
     * Counters summed over all participants.
     */
    public ParticipantCounters totals() {
        long received = 0, sent = 0, votes = 0, commits = 0, aborts = 0, blocks = 0, errors = 0;
        for (ParticipantReport p : participants) {
            ParticipantCounters c = p.counters();
            received += c.proposalsReceived();
            sent += c.proposalsSent();
            votes += c.votesSent();
            commits += c.commits();
            aborts += c.aborts();
            blocks += c.blocksSent();
            errors += c.decodeErrors();
        }
        return new ParticipantCounters(received, sent, votes, commits, aborts, blocks, errors);
    }
}
