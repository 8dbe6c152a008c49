package io.ctxsync.core.merge;

/** Why a contested field went to the side it went to. */
public enum DecisionReason {
    /** The field (or its prefix) is configured as owned by the winner. */
    AUTHORITY,
    /** Winner's view was updated later. */
    MOST_RECENT,
    /** Equal timestamps; A wins so the result is reproducible. */
    TIE_BREAK
}
