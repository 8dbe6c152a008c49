package io.ctxsync.sync;

import java.util.Optional;

/**
 * One producer system whose view of a context is pulled during a sync pass.
 * <p>
 * Implementations may block on I/O; SyncEngine bounds every call with the
 * pass's fetch deadline and treats an exception as "no view this pass".
 */
public interface ExternalSystem {

    /** Short name used in logs. */
    String name();

    /** @return the system's current view, or empty when it holds nothing for this id */
    Optional<SourceSnapshot> fetchCurrent(String contextId);

    /** A system that never has a view; used when a producer is not configured. */
    static ExternalSystem none(String name) {
        return new ExternalSystem() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Optional<SourceSnapshot> fetchCurrent(String contextId) {
                return Optional.empty();
            }
        };
    }
}
