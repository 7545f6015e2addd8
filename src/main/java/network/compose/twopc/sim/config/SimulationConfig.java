package network.compose.twopc.sim.config;

import network.compose.twopc.sim.internal.time.DurationRange;
import network.compose.twopc.sim.policy.VoteStrategy;
import network.compose.twopc.sim.policy.VoteTiming;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Everything one simulation run needs to know.
 *
 * <p>Build it with {@link #builder()} in code, or from command-line flags with
 * {@link #parse(String[])}. Every field has a default, so an empty argument
 * list is a valid run: three committing sequencers against
 * {@code localhost:8080} for thirty seconds.</p>
 *
 * @param strategyOverrides per-participant strategies by index; participants
 *                          past the end of the list use {@code voteStrategy}
 * @param seed              seeds every random draw of the run when present
 */
public record SimulationConfig(
    String host,
    int port,
    int clients,
    VoteStrategy voteStrategy,
    List<VoteStrategy> strategyOverrides,
    boolean sendTx,
    int txCount,
    Duration duration,
    Duration connectStagger,
    Duration readTimeout,
    Duration connectTimeout,
    Duration joinTimeout,
    VoteTiming voteTiming,
    DurationRange blockSettle,
    DurationRange originationSpacing,
    TransportKind transport,
    OptionalLong seed
) {
    public static final String USAGE = String.join(System.lineSeparator(),
        "Usage: twopc-participant-sim [options]",
        "  --host <host>              coordinator host (default localhost)",
        "  --port <port>              coordinator port (default 8080)",
        "  --clients <n>              number of simulated sequencers (default 3)",
        "  --vote-strategy <s>        commit|abort|random|delay for every sequencer (default commit)",
        "  --strategies <s,s,...>     per-sequencer strategies, in order; overrides --vote-strategy",
        "  --send-tx                  have the first sequencer originate transactions",
        "  --tx-count <n>             transactions to originate with --send-tx (default 1)",
        "  --duration <seconds>       how long to run (default 30)",
        "  --transport <t>            socket|netty (default socket)",
        "  --seed <long>              seed for reproducible delays and random votes",
        "  --help                     print this message");

    private static final Set<String> FLAGS = Set.of("send-tx");

    public SimulationConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(voteStrategy, "voteStrategy");
        strategyOverrides = List.copyOf(Objects.requireNonNull(strategyOverrides, "strategyOverrides"));
        Objects.requireNonNull(duration, "duration");
        Objects.requireNonNull(connectStagger, "connectStagger");
        Objects.requireNonNull(readTimeout, "readTimeout");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(joinTimeout, "joinTimeout");
        Objects.requireNonNull(voteTiming, "voteTiming");
        Objects.requireNonNull(blockSettle, "blockSettle");
        Objects.requireNonNull(originationSpacing, "originationSpacing");
        Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(seed, "seed");

        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port < 1 || port > 65_535) {
            throw new IllegalArgumentException("port must be in range 1-65535 (was " + port + ")");
        }
        if (clients < 1) {
            throw new IllegalArgumentException("clients must be >= 1 (was " + clients + ")");
        }
        if (txCount < 0) {
            throw new IllegalArgumentException("txCount must be >= 0 (was " + txCount + ")");
        }
        requirePositive(duration, "duration");
        requirePositive(readTimeout, "readTimeout");
        requirePositive(connectTimeout, "connectTimeout");
        requirePositive(joinTimeout, "joinTimeout");
        if (connectStagger.isNegative()) {
            throw new IllegalArgumentException("connectStagger must be >= 0");
        }
    }

    /**
     * Strategy of the participant at {@code index}.
     */
    public VoteStrategy strategyFor(int index) {
        return index < strategyOverrides.size() ? strategyOverrides.get(index) : voteStrategy;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static boolean isHelpRequested(String[] args) {
        for (String arg : args) {
            if (arg.equalsIgnoreCase("--help") || arg.equals("-h")) {
                return true;
            }
        }
        return false;
    }

    /**
     * Parse {@code --flag value} options into a configuration.
     *
     * @throws IllegalArgumentException on an unknown option, a missing value
     *                                  or a value out of range
     */
    public static SimulationConfig parse(String[] args) {
        Objects.requireNonNull(args, "args");

        Map<String, String> options = new LinkedHashMap<>();
        for (int i = 0; i < args.length; i++) {
            String token = args[i];
            if (!token.startsWith("--")) {
                throw new IllegalArgumentException("Unexpected argument '" + token + "'. Arguments must start with --");
            }
            String key = token.substring(2).toLowerCase(Locale.ROOT);
            if (key.isBlank()) {
                throw new IllegalArgumentException("Empty option at position " + i);
            }
            if (FLAGS.contains(key)) {
                options.put(key, "true");
                continue;
            }
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("Missing value for option --" + key);
            }
            options.put(key, args[++i]);
        }

        Builder b = builder();
        for (Map.Entry<String, String> option : options.entrySet()) {
            String value = option.getValue();
            switch (option.getKey()) {
                case "host" -> b.withHost(value.trim());
                case "port" -> b.withPort(parseInt(value, "port"));
                case "clients" -> b.withClients(parseInt(value, "clients"));
                case "vote-strategy" -> b.withVoteStrategy(VoteStrategy.parse(value));
                case "strategies" -> b.withStrategyOverrides(parseStrategies(value));
                case "send-tx" -> b.withSendTx(true);
                case "tx-count" -> b.withTxCount(parseInt(value, "tx-count"));
                case "duration" -> b.withDuration(Duration.ofSeconds(parseLong(value, "duration")));
                case "transport" -> b.withTransport(TransportKind.parse(value));
                case "seed" -> b.withSeed(parseLong(value, "seed"));
                default -> throw new IllegalArgumentException("Unknown option --" + option.getKey());
            }
        }
        return b.build();
    }

    private static List<VoteStrategy> parseStrategies(String list) {
        List<VoteStrategy> strategies = new ArrayList<>();
        for (String entry : list.split(",")) {
            if (!entry.isBlank()) {
                strategies.add(VoteStrategy.parse(entry));
            }
        }
        if (strategies.isEmpty()) {
            throw new IllegalArgumentException("--strategies did not contain any entries");
        }
        return strategies;
    }

    private static int parseInt(String raw, String label) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid value for --" + label + ": '" + raw + "'", ex);
        }
    }

    private static long parseLong(String raw, String label) {
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid value for --" + label + ": '" + raw + "'", ex);
        }
    }

    private static void requirePositive(Duration d, String label) {
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(label + " must be > 0 (was " + d + ")");
        }
    }

    public static final class Builder {
        private String host = "localhost";
        private int port = 8080;
        private int clients = 3;
        private VoteStrategy voteStrategy = VoteStrategy.COMMIT;
        private List<VoteStrategy> strategyOverrides = List.of();
        private boolean sendTx;
        private int txCount = 1;
        private Duration duration = Duration.ofSeconds(30);
        private Duration connectStagger = Duration.ofMillis(500);
        private Duration readTimeout = Duration.ofSeconds(1);
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration joinTimeout = Duration.ofSeconds(2);
        private VoteTiming voteTiming = VoteTiming.defaults();
        private DurationRange blockSettle = DurationRange.ofMillis(500, 1_500);
        private DurationRange originationSpacing = DurationRange.ofMillis(1_000, 3_000);
        private TransportKind transport = TransportKind.SOCKET;
        private OptionalLong seed = OptionalLong.empty();

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withClients(int clients) {
            this.clients = clients;
            return this;
        }

        public Builder withVoteStrategy(VoteStrategy voteStrategy) {
            this.voteStrategy = voteStrategy;
            return this;
        }

        public Builder withStrategyOverrides(List<VoteStrategy> strategyOverrides) {
            this.strategyOverrides = strategyOverrides;
            return this;
        }

        public Builder withSendTx(boolean sendTx) {
            this.sendTx = sendTx;
            return this;
        }

        public Builder withTxCount(int txCount) {
            this.txCount = txCount;
            return this;
        }

        public Builder withDuration(Duration duration) {
            this.duration = duration;
            return this;
        }

        public Builder withConnectStagger(Duration connectStagger) {
            this.connectStagger = connectStagger;
            return this;
        }

        public Builder withReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        public Builder withConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder withJoinTimeout(Duration joinTimeout) {
            this.joinTimeout = joinTimeout;
            return this;
        }

        public Builder withVoteTiming(VoteTiming voteTiming) {
            this.voteTiming = voteTiming;
            return this;
        }

        public Builder withBlockSettle(DurationRange blockSettle) {
            this.blockSettle = blockSettle;
            return this;
        }

        public Builder withOriginationSpacing(DurationRange originationSpacing) {
            this.originationSpacing = originationSpacing;
            return this;
        }

        public Builder withTransport(TransportKind transport) {
            this.transport = transport;
            return this;
        }

        public Builder withSeed(long seed) {
            this.seed = OptionalLong.of(seed);
            return this;
        }

        public SimulationConfig build() {
            return new SimulationConfig(host, port, clients, voteStrategy, strategyOverrides, sendTx, txCount,
                duration, connectStagger, readTimeout, connectTimeout, joinTimeout, voteTiming, blockSettle,
                originationSpacing, transport, seed);
        }
    }
}
