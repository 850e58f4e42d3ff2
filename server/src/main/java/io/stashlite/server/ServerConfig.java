// file: server/src/main/java/io/stashlite/server/ServerConfig.java
package io.stashlite.server;

/**
 * Daemon configuration parsed from CLI args.
 *
 * Supports:
 *  - host:       interface the HTTP listener binds to
 *  - httpPort:   HTTP API port
 *  - dataDir:    root directory for records, queue and key (ignored when a config file is given)
 *  - configPath: optional JSON cache config (see CacheConfig)
 */
public record ServerConfig(
        String host,
        int httpPort,
        String dataDir,
        String configPath
) {

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --host,      -H   <host>
     *   --http-port, -p   <port>
     *   --data-dir,  -d   <path>
     *   --config,    -c   <path>
     *   --help,      -h
     *
     * All flags are optional; defaults are reasonable for local use.
     */
    public static ServerConfig fromArgs(String[] args) {
        // Defaults
        String host = "127.0.0.1";
        int httpPort = 8787;
        String dataDir = "./stash-data";
        String configPath = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--host", "-H" -> {
                    ensureValue(args, i);
                    host = args[++i];
                }

                case "--http-port", "-p" -> {
                    ensureValue(args, i);
                    try {
                        httpPort = Integer.parseInt(args[++i]);
                    } catch (NumberFormatException e) {
                        System.err.println("Invalid http-port: " + args[i]);
                        System.exit(1);
                    }
                }

                case "--data-dir", "-d" -> {
                    ensureValue(args, i);
                    dataDir = args[++i];
                }

                case "--config", "-c" -> {
                    ensureValue(args, i);
                    configPath = args[++i];
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        return new ServerConfig(host, httpPort, dataDir, configPath);
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: stashd [options]

            Options:
              --host,      -H   Bind address (default: 127.0.0.1)
              --http-port, -p   HTTP port (default: 8787)
              --data-dir,  -d   Data directory (default: ./stash-data)
              --config,    -c   Path to JSON cache config (optional)
              --help,      -h   Show this help message
            """);
        System.exit(0);
    }
}
