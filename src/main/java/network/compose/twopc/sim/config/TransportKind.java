package network.compose.twopc.sim.config;

import java.util.Locale;

/**
 * Which {@code StreamEndpoint} implementation the harness builds.
 */
public enum TransportKind {
    /** Blocking socket with a dedicated reader thread doing timed reads. */
    SOCKET,
    /** Netty NIO channel with length-field framing handlers. */
    NETTY;

    /**
     * @throws IllegalArgumentException if {@code name} matches no transport
     */
    public static TransportKind parse(String name) {
        if (name != null) {
            String normalized = name.trim().toUpperCase(Locale.ROOT);
            for (TransportKind k : values()) {
                if (k.name().equals(normalized)) {
                    return k;
                }
            }
        }
        throw new IllegalArgumentException("Unknown transport '" + name + "'; expected socket|netty");
    }
}
