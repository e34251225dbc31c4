package app.sage.core.review.controller.dto;

import app.sage.core.review.domain.Rating;
import app.sage.core.review.domain.SchedulingState;
import app.sage.core.review.session.RatingOutcome;
import app.sage.core.review.session.SessionProgress;

import java.util.UUID;

public record RatingResponse(
        RatingOutcome.Status status,
        String reason,
        UUID cardId,
        Rating rating,
        SchedulingState nextState,
        SessionProgress progress
) {
    public static RatingResponse of(RatingOutcome outcome, SessionProgress progress) {
        return new RatingResponse(outcome.status(), outcome.reason(), outcome.cardId(), outcome.rating(),
                outcome.nextState(), progress);
    }
}
