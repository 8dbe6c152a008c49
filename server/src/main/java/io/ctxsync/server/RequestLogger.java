// file: server/src/main/java/io/ctxsync/server/RequestLogger.java
package io.ctxsync.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-request logging for the admin listener.
 *
 * Responsibilities:
 *  - Central place to log method/path/status and latency.
 *  - Server errors carry their exception at WARNING; everything else is FINE
 *    so routine health probes stay out of the default log.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * @param method      HTTP method
     * @param path        request path
     * @param status      HTTP status code
     * @param totalMillis wall-clock latency of the whole request
     * @param error       exception behind a 5xx, or null
     */
    public static void logRequest(String method, String path, int status, long totalMillis, Throwable error) {
        String msg = String.format("HTTP %s %s -> %d (total=%dms)", method, path, status, totalMillis);
        if (status >= 500) {
            if (error != null) {
                log.log(Level.WARNING, msg, error);
            } else {
                log.log(Level.WARNING, msg);
            }
        } else {
            log.log(Level.FINE, msg);
        }
    }
}
