package app.sage.core.review.session;

import app.sage.core.review.domain.Rating;
import app.sage.core.review.domain.SchedulingState;

import java.util.UUID;

/**
 * Result of {@code rateCard}. Refusals and rejections leave the session untouched.
 *
 * @param previousState state before the rating, {@code null} unless accepted
 * @param nextState     optimistic state after the rating, {@code null} unless accepted
 */
public record RatingOutcome(
        Status status,
        String reason,
        UUID cardId,
        Rating rating,
        SchedulingState previousState,
        SchedulingState nextState
) {
    public enum Status {
        ACCEPTED,
        /** The rating is valid but not allowed for the current card. */
        REFUSED,
        /** The request itself is invalid. */
        REJECTED
    }

    public static RatingOutcome accepted(UUID cardId, Rating rating, SchedulingState previous, SchedulingState next) {
        return new RatingOutcome(Status.ACCEPTED, null, cardId, rating, previous, next);
    }

    public static RatingOutcome refused(UUID cardId, Rating rating, String reason) {
        return new RatingOutcome(Status.REFUSED, reason, cardId, rating, null, null);
    }

    public static RatingOutcome rejected(String reason) {
        return new RatingOutcome(Status.REJECTED, reason, null, null, null, null);
    }

    public boolean isAccepted() {
        return status == Status.ACCEPTED;
    }
}
