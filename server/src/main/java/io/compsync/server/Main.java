// file: server/src/main/java/io/compsync/server/Main.java
package io.compsync.server;

import io.compsync.core.diag.LoggingDiagnostics;
import io.compsync.core.diag.OverrideDiagnostics;
import io.compsync.storage.DocumentLibrary;
import io.compsync.storage.DocumentReader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point for the override server.
 *
 * Responsibilities:
 *  - Parse configuration from CLI.
 *  - Build the document library and preload a library directory.
 *  - Create OverrideService and WebServer.
 *  - Start HTTP server and stop it on shutdown.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) throws IOException {
        configureLogging();
        var cfg = ServerConfig.fromArgs(args);

        OverrideDiagnostics diagnostics = cfg.diagnostics()
                ? new LoggingDiagnostics()
                : OverrideDiagnostics.NOOP;

        // ------ Documents ------
        var library = new DocumentLibrary(diagnostics);
        if (cfg.libraryDir() != null && !cfg.libraryDir().isBlank()) {
            List<String> loaded = library.loadDirectory(Path.of(cfg.libraryDir()), new DocumentReader());
            log.info(() -> "preloaded " + loaded.size() + " documents from " + cfg.libraryDir());
        }

        // ------ Service + HTTP layer ------
        var service = new OverrideService(library, cfg.diffPolicy(), diagnostics, cfg.workers());
        var web = new WebServer(cfg.httpPort(), service);
        web.start();

        System.out.printf("compsync server listening on http://%s:%d%n", "localhost", cfg.httpPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            web.stop();
            service.close();
        }));
    }

    /** Bundled logging.properties, unless one was given with -Djava.util.logging.config.file. */
    private static void configureLogging() throws IOException {
        if (System.getProperty("java.util.logging.config.file") != null) return;
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) LogManager.getLogManager().readConfiguration(in);
        }
    }
}
