package io.ctxsync.core;

/**
 * Provenance of a committed context version.
 * <p>
 * A and B are the two producer systems. MERGED marks versions whose payload
 * was assembled from more than one input (a sync pass that saw both views, or
 * an explicit mergeContexts call).
 */
public enum SourceSystem {
    A,
    B,
    MERGED;

    /** Parse case-insensitively ("a", "B", "merged"). */
    public static SourceSystem parse(String raw) {
        if (raw == null) throw new IllegalArgumentException("source must not be null");
        return switch (raw.trim().toUpperCase(java.util.Locale.ROOT)) {
            case "A" -> A;
            case "B" -> B;
            case "MERGED" -> MERGED;
            default -> throw new IllegalArgumentException("unknown source system: " + raw);
        };
    }
}
