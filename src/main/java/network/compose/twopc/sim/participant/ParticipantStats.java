package network.compose.twopc.sim.participant;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Mutable counters behind {@link ParticipantCounters}.
 *
 * <p>Written from the participant's scheduler, read from any thread.</p>
 */
final class ParticipantStats
{
    final AtomicLong proposalsReceived = new AtomicLong();
    final AtomicLong proposalsSent = new AtomicLong();
    final AtomicLong votesSent = new AtomicLong();
    final AtomicLong commits = new AtomicLong();
    final AtomicLong aborts = new AtomicLong();
    final AtomicLong blocksSent = new AtomicLong();
    final AtomicLong decodeErrors = new AtomicLong();

    ParticipantCounters snapshot() {
        return new ParticipantCounters(
                proposalsReceived.get(),
                proposalsSent.get(),
                votesSent.get(),
                commits.get(),
                aborts.get(),
                blocksSent.get(),
                decodeErrors.get());
    }
}
