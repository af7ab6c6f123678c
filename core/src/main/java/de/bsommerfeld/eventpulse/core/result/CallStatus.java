package de.bsommerfeld.eventpulse.core.result;

/**
 * Outcome of a call into an external capability (storage or Reddit).
 * Expected conditions are values here instead of exceptions, so callers
 * branch on them explicitly.
 */
public enum CallStatus {

    OK,

    /** A uniqueness constraint rejected the write. Expected, never an error. */
    DUPLICATE,

    /** The addressed table, subreddit or item does not exist. */
    NOT_FOUND,

    /** The addressed resource exists but is private, banned or quarantined. */
    FORBIDDEN,

    /** Timeout, rate limit, I/O or server failure. Safe to retry later. */
    TRANSIENT_ERROR
}
