package app.sage.core.card.adapter;

import app.sage.core.card.domain.entity.CardEntity;
import app.sage.core.card.repository.CardRepository;
import app.sage.core.review.api.CardCatalogPort;
import app.sage.core.review.domain.CardKind;
import app.sage.core.review.domain.StudyCard;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
public class CardCatalogAdapter implements CardCatalogPort {

    private static final Logger log = LoggerFactory.getLogger(CardCatalogAdapter.class);

    private final CardRepository cardRepository;

    public CardCatalogAdapter(CardRepository cardRepository) {
        this.cardRepository = cardRepository;
    }

    @Override
    public List<StudyCard> findCards(List<UUID> cardIds) {
        if (cardIds == null || cardIds.isEmpty()) {
            return List.of();
        }

        Map<UUID, CardEntity> byId = cardRepository.findAllById(cardIds).stream()
                .collect(Collectors.toMap(CardEntity::getId, Function.identity()));

        List<StudyCard> result = new ArrayList<>(cardIds.size());
        for (UUID id : cardIds) {
            CardEntity entity = byId.get(id);
            if (entity == null) {
                log.warn("Card not found cardId={}", id);
                continue;
            }
            StudyCard card = toStudyCard(entity);
            if (card != null) {
                result.add(card);
            }
        }
        return result;
    }

    @Override
    public List<UUID> findUnstartedCardIds(UUID deckId, Collection<UUID> startedCardIds, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        PageRequest page = PageRequest.of(0, limit);
        if (startedCardIds == null || startedCardIds.isEmpty()) {
            return cardRepository.findIdsByDeckId(deckId, page);
        }
        return cardRepository.findIdsByDeckIdExcluding(deckId, startedCardIds, page);
    }

    @Override
    public long countDeckCards(UUID deckId) {
        return cardRepository.countByDeckId(deckId);
    }

    private static StudyCard toStudyCard(CardEntity entity) {
        List<String> options = options(entity.getOptions());
        CardKind kind = "choice".equalsIgnoreCase(entity.getKind()) ? CardKind.CHOICE : CardKind.SIMPLE;
        try {
            return new StudyCard(
                    entity.getId(),
                    entity.getDeckId(),
                    entity.getPrompt(),
                    entity.getAnswer(),
                    entity.getPromptImage(),
                    entity.getAnswerImage(),
                    kind,
                    kind == CardKind.CHOICE ? options : List.of(),
                    entity.getPosition()
            );
        } catch (IllegalArgumentException ex) {
            log.warn("Skipping malformed card cardId={} error={}", entity.getId(), ex.getMessage());
            return null;
        }
    }

    private static List<String> options(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (JsonNode option : node) {
            if (option.isTextual() && !option.asText().isBlank()) {
                out.add(option.asText());
            }
        }
        return out;
    }
}
