package app.sage.core.review.domain;

import java.util.UUID;

public record DeckStats(
        UUID deckId,
        long totalCards,
        long newCards,
        long learningCards,
        long reviewCards,
        long relearningCards,
        long dueNow,
        long newAvailableToday,
        long masteredCards,
        double masteryRatio
) {
}
