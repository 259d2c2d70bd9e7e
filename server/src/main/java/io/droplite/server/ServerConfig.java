package io.droplite.server;

/**
 * Process configuration parsed from CLI args.
 *
 * Supports:
 *  - httpPort:    external HTTP API port
 *  - walDir:      directory for WAL segments
 *  - snapDir:     directory for snapshots
 *  - configPath:  optional JSON distribution policy (defaults from the classpath)
 *  - relayerKey:  optional hex private key; enables the daily relayer run
 *  - rewardsDir:  directory of scored rewards read by the relayer run
 */
public record ServerConfig(
        int httpPort,
        String walDir,
        String snapDir,
        String configPath,
        String relayerKey,
        String rewardsDir
) {

    /** True when both a signing key and a rewards directory were given. */
    public boolean relayerEnabled() {
        return relayerKey != null && !relayerKey.isBlank() && rewardsDir != null && !rewardsDir.isBlank();
    }

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --http-port,   -p   <port>
     *   --wal,         -w   <path>
     *   --snap,        -s   <path>
     *   --config,      -c   <path>
     *   --relayer-key, -k   <hex>
     *   --rewards,     -r   <path>
     *   --help,        -h
     *
     * All flags are optional; defaults are reasonable for local dev.
     */
    public static ServerConfig fromArgs(String[] args) {
        // Defaults
        int httpPort = 8080;
        String wal = "./data/wal";
        String snap = "./data/snap";
        String configPath = null;
        String relayerKey = System.getenv("DROPLITE_RELAYER_KEY");
        String rewardsDir = null;

        // CLIArg Parser
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--http-port", "-p" -> {
                    ensureValue(args, i);
                    try {
                        httpPort = Integer.parseInt(args[++i]);
                    } catch (NumberFormatException e) {
                        System.err.println("Invalid http-port: " + args[i]);
                        System.exit(1);
                    }
                }

                case "--wal", "-w" -> {
                    ensureValue(args, i);
                    wal = args[++i];
                }

                case "--snap", "-s" -> {
                    ensureValue(args, i);
                    snap = args[++i];
                }

                case "--config", "-c" -> {
                    ensureValue(args, i);
                    configPath = args[++i];
                }

                case "--relayer-key", "-k" -> {
                    ensureValue(args, i);
                    relayerKey = args[++i];
                }

                case "--rewards", "-r" -> {
                    ensureValue(args, i);
                    rewardsDir = args[++i];
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        return new ServerConfig(httpPort, wal, snap, configPath, relayerKey, rewardsDir);
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: server [options]

            Options:
              --http-port,   -p   HTTP port (default: 8080)
              --wal,         -w   WAL directory (default: ./data/wal)
              --snap,        -s   Snapshot directory (default: ./data/snap)
              --config,      -c   Path to JSON distribution config (optional)
              --relayer-key, -k   Relayer private key in hex (or DROPLITE_RELAYER_KEY)
              --rewards,     -r   Directory of scored rewards <day>/<CATEGORY>.json
              --help,        -h   Show this help message
            """);
        System.exit(0);
    }
}
