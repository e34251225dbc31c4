package app.sage.core.review.domain;

/**
 * Delivery state of a logged review towards the remote scheduler.
 */
public enum ReviewSyncStatus {
    PENDING, SYNCED
}
