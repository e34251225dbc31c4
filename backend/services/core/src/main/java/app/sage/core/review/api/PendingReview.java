package app.sage.core.review.api;

import app.sage.core.review.domain.Rating;

import java.time.Instant;
import java.util.UUID;

/**
 * A logged review that has not been confirmed by the remote scheduler yet.
 *
 * @param reviewLogId id of the review log row, {@code null} when the log write failed
 */
public record PendingReview(
        Long reviewLogId,
        UUID learnerId,
        UUID cardId,
        Rating rating,
        long reviewTimeMs,
        Instant reviewedAt,
        int attempts
) {
}
