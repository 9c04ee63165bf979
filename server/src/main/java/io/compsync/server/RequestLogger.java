// file: server/src/main/java/io/compsync/server/RequestLogger.java
package io.compsync.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Request-level logging hook.
 *
 * Responsibilities:
 *  - Central place to log method/path/status and latency.
 *  - Separates time spent computing overrides from total request time.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed HTTP request.
     *
     * @param method        HTTP method
     * @param path          request path
     * @param status        HTTP status code
     * @param totalMillis   wall-clock latency for the whole request
     * @param computeMillis time spent in OverrideService, or -1 if not measured
     * @param error         optional exception, null if none
     */
    public static void logRequest(
            String method,
            String path,
            int status,
            long totalMillis,
            long computeMillis,
            Throwable error
    ) {
        String msg = String.format(
                "HTTP %s %s -> %d (total=%dms%s)",
                method,
                path,
                status,
                totalMillis,
                computeMillis >= 0 ? ", compute=" + computeMillis + "ms" : ""
        );

        if (status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else if (error != null) {
            log.log(Level.FINE, msg + ": " + error.getMessage());
        } else {
            log.log(Level.INFO, msg);
        }
    }
}
