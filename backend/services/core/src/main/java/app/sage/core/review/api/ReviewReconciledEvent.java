package app.sage.core.review.api;

import app.sage.core.review.domain.AuthoritativeState;

import java.time.Instant;
import java.util.UUID;

/**
 * Published once the remote scheduler's answer for a review has been written to the store.
 */
public record ReviewReconciledEvent(
        UUID learnerId,
        UUID cardId,
        Instant reviewedAt,
        AuthoritativeState state
) {
}
