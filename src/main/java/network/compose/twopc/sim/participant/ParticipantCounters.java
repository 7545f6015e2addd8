package network.compose.twopc.sim.participant;

/**
 * Point-in-time copy of one participant's activity counters.
 *
 * @param proposalsReceived XTRequest broadcasts received
 * @param proposalsSent     XTRequests this participant originated
 * @param votesSent         votes written to the connection
 * @param commits           commit decisions applied
 * @param aborts            abort decisions applied
 * @param blocksSent        block confirmations written
 * @param decodeErrors      inbound frames discarded as undecodable
 */
public record ParticipantCounters(
        long proposalsReceived,
        long proposalsSent,
        long votesSent,
        long commits,
        long aborts,
        long blocksSent,
        long decodeErrors
) {
    public static final ParticipantCounters ZERO = new ParticipantCounters(0, 0, 0, 0, 0, 0, 0);

    /** Proposals seen from either direction. */
    public long proposalsSeen() {
        return proposalsReceived + proposalsSent;
    }
}
