package io.droplite.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Minimal hook for request-level logging.
 *
 * Central place to log method/path/status and latency, plus the ledger time
 * spent inside validator or claim processing.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed HTTP request.
     *
     * @param method       HTTP method (GET, POST, etc.)
     * @param path         request path
     * @param status       HTTP status code
     * @param totalMillis  wall-clock latency for the whole request
     * @param ledgerMillis time spent in submit/claim processing, or -1 if not measured
     * @param error        optional exception, null if none
     */
    public static void logRequest(
            String method,
            String path,
            int status,
            long totalMillis,
            long ledgerMillis,
            Throwable error
    ) {
        String msg = String.format(
                "HTTP %s %s -> %d (total=%dms%s)",
                method,
                path,
                status,
                totalMillis,
                ledgerMillis >= 0 ? ", ledger=" + ledgerMillis + "ms" : ""
        );

        if (error != null && status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else if (status >= 500) {
            log.log(Level.WARNING, msg);
        } else if (error != null) {
            log.log(Level.INFO, msg + " [" + error.getMessage() + "]");
        } else {
            log.log(Level.INFO, msg);
        }
    }
}
