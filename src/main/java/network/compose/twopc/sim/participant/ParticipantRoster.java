package network.compose.twopc.sim.participant;

import network.compose.twopc.sim.model.ChainId;

/**
 * Deterministic identity assignment by participant index.
 *
 * <ul>
 *   <li>Client ids run {@code sequencer-A} .. {@code sequencer-Z}, then
 *       {@code sequencer-AA}, {@code sequencer-AB}, ...</li>
 *   <li>The first three participants take the chains of the default proposal.
 *       Participant {@code i >= 3} gets {@code [(0x15 + i) & 0xFF, (0x37 + i) & 0xFF]}.</li>
 * </ul>
 */
public final class ParticipantRoster
{
    public static final String CLIENT_ID_PREFIX = "sequencer-";

    private ParticipantRoster() {}

    public static ParticipantIdentity identityFor(int index) {
        return new ParticipantIdentity(clientIdFor(index), chainIdFor(index));
    }

    public static String clientIdFor(int index) {
        requireIndex(index);
        // Bijective base 26: A..Z, AA..ZZ, AAA..
        StringBuilder suffix = new StringBuilder();
        int n = index + 1;
        while (n > 0) {
            n--;
            suffix.insert(0, (char) ('A' + n % 26));
            n /= 26;
        }
        return CLIENT_ID_PREFIX + suffix;
    }

    public static ChainId chainIdFor(int index) {
        requireIndex(index);
        if (index < DefaultProposal.CHAINS.size()) {
            return DefaultProposal.CHAINS.get(index);
        }
        return ChainId.of((byte) ((0x15 + index) & 0xFF), (byte) ((0x37 + index) & 0xFF));
    }

    private static void requireIndex(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0 (was " + index + ")");
        }
    }
}
