package io.ctxsync.storage;

import java.util.List;

/**
 * Held serialization points for a set of contexts.
 * <p>
 * While open, commits, restores and reads of these contexts from other threads
 * wait; the holder's own commits and reads go through. Close releases in reverse order and
 * must happen on the acquiring thread.
 */
public interface CommitLease extends AutoCloseable {

    /** Sorted, distinct ids covered by this lease. */
    List<String> contextIds();

    @Override
    void close();
}
