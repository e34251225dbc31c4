package app.sage.core.review.controller.dto;

import java.util.List;
import java.util.UUID;

public record StartSessionRequest(
        UUID deckId,
        List<UUID> cardIds
) {}
