package app.sage.core.review.session;

import app.sage.core.review.domain.Rating;

import java.util.Set;
import java.util.UUID;

public record ChoiceAnswerOutcome(
        boolean accepted,
        String reason,
        UUID cardId,
        boolean correct,
        String correctAnswer,
        Set<Rating> allowedRatings
) {
    public static ChoiceAnswerOutcome answered(UUID cardId, boolean correct, String correctAnswer, Set<Rating> allowed) {
        return new ChoiceAnswerOutcome(true, null, cardId, correct, correctAnswer, Set.copyOf(allowed));
    }

    public static ChoiceAnswerOutcome rejected(String reason) {
        return new ChoiceAnswerOutcome(false, reason, null, false, null, Set.of());
    }
}
