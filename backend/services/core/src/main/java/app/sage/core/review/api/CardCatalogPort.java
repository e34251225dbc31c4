package app.sage.core.review.api;

import app.sage.core.review.domain.StudyCard;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Read-only access to card content.
 */
public interface CardCatalogPort {

    /**
     * Returns the cards in the order of {@code cardIds}. Unknown ids are skipped.
     */
    List<StudyCard> findCards(List<UUID> cardIds);

    /**
     * Returns up to {@code limit} card ids of the deck in deck order, leaving out {@code startedCardIds}.
     */
    List<UUID> findUnstartedCardIds(UUID deckId, Collection<UUID> startedCardIds, int limit);

    long countDeckCards(UUID deckId);
}
