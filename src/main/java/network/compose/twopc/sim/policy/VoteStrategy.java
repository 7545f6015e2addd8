package network.compose.twopc.sim.policy;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * How a simulated sequencer votes.
 *
 * <p>The set is closed. A strategy is resolved once, when a participant is
 * built, into a {@link VotePolicy}.</p>
 */
public enum VoteStrategy {
    /** Always commit, after the participant's fixed base delay. */
    COMMIT,
    /** Always abort, after the participant's fixed base delay. */
    ABORT,
    /** Commit or abort with equal probability, after the base delay. */
    RANDOM,
    /** Always commit, after a fresh delay longer than the coordinator's vote timeout. */
    DELAY;

    /**
     * Parses a strategy name case-insensitively ({@code "commit"}, {@code "Delay"}, ...).
     *
     * @throws IllegalArgumentException if the name matches no strategy
     */
    public static VoteStrategy parse(String name) {
        if (name != null) {
            String normalized = name.trim().toUpperCase(Locale.ROOT);
            for (VoteStrategy s : values()) {
                if (s.name().equals(normalized)) {
                    return s;
                }
            }
        }
        throw new IllegalArgumentException("Unknown vote strategy '" + name + "'; expected one of "
                + Arrays.stream(values()).map(s -> s.name().toLowerCase(Locale.ROOT)).collect(Collectors.joining("|")));
    }
}
