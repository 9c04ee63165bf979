// file: server/src/main/java/io/compsync/server/ServerConfig.java
package io.compsync.server;

import io.compsync.core.diff.DiffPolicy;

/**
 * Server configuration parsed from CLI args.
 *
 * Supports:
 *  - httpPort:     HTTP API port
 *  - libraryDir:   optional directory of *.json documents loaded at startup
 *  - epsilon:      numeric tolerance for geometry and typography comparisons
 *  - workers:      size of the pool computing whole-document overrides
 *  - diagnostics:  log diagnostic events (resolution, diffs, collisions)
 */
public record ServerConfig(
        int httpPort,
        String libraryDir,
        double epsilon,
        int workers,
        boolean diagnostics
) {

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --http-port,   -p   <port>
     *   --library-dir, -l   <path>
     *   --epsilon           <double>
     *   --workers           <count>
     *   --diagnostics
     *   --help,        -h
     *
     * All flags are optional; defaults are reasonable for local dev.
     */
    public static ServerConfig fromArgs(String[] args) {
        // Defaults
        int httpPort = 8080;
        String libraryDir = null;
        double epsilon = DiffPolicy.DEFAULT_EPSILON;
        int workers = Runtime.getRuntime().availableProcessors();
        boolean diagnostics = false;

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

                case "--library-dir", "-l" -> {
                    ensureValue(args, i);
                    libraryDir = args[++i];
                }

                case "--epsilon" -> {
                    ensureValue(args, i);
                    try {
                        epsilon = Double.parseDouble(args[++i]);
                    } catch (NumberFormatException e) {
                        System.err.println("Invalid epsilon: " + args[i]);
                        System.exit(1);
                    }
                    if (!(epsilon >= 0)) {
                        System.err.println("epsilon must be >= 0");
                        System.exit(1);
                    }
                }

                case "--workers" -> {
                    ensureValue(args, i);
                    try {
                        workers = Integer.parseInt(args[++i]);
                    } catch (NumberFormatException e) {
                        System.err.println("Invalid workers: " + args[i]);
                        System.exit(1);
                    }
                    if (workers <= 0) {
                        System.err.println("workers must be > 0");
                        System.exit(1);
                    }
                }

                case "--diagnostics" -> diagnostics = true;

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        return new ServerConfig(httpPort, libraryDir, epsilon, workers, diagnostics);
    }

    public DiffPolicy diffPolicy() {
        return DiffPolicy.withEpsilon(epsilon);
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: compsync-server [options]

            Options:
              --http-port,   -p   HTTP port (default: 8080)
              --library-dir, -l   Directory of JSON documents to load at startup (optional)
              --epsilon           Numeric comparison tolerance (default: 0.01)
              --workers           Worker threads for whole-document computation (default: #cpus)
              --diagnostics       Log resolution and diff diagnostics
              --help,        -h   Show this help message
            """);
        System.exit(0);
    }
}
