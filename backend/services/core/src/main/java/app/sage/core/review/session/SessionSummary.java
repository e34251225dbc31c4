package app.sage.core.review.session;

import java.time.Instant;
import java.util.UUID;

public record SessionSummary(
        UUID sessionId,
        UUID learnerId,
        UUID deckId,
        SessionStatus status,
        int total,
        int reviewed,
        int correct,
        Instant startedAt
) {
    public double accuracy() {
        return reviewed == 0 ? 0.0 : (double) correct / reviewed;
    }
}
