package app.sage.core.review.api;

/**
 * Published after a rating has been applied locally and logged.
 */
public record ReviewRecordedEvent(PendingReview review) {
}
