package app.sage.core.review.domain;

import java.time.Instant;
import java.util.UUID;

public record ReviewRecord(
        UUID cardId,
        UUID deckId,
        Rating rating,
        CardPhase phaseAtReview,
        long reviewTimeMs,
        Instant reviewedAt
) {
}
