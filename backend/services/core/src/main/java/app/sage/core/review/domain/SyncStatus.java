package app.sage.core.review.domain;

/**
 * Provenance of a stored scheduling record.
 */
public enum SyncStatus {
    OPTIMISTIC, CONFIRMED
}
