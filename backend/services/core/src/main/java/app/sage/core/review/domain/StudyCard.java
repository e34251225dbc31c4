package app.sage.core.review.domain;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

public record StudyCard(
        UUID id,
        UUID deckId,
        String prompt,
        String answer,
        String promptImage,
        String answerImage,
        CardKind kind,
        List<String> options,
        int position
) {
    public StudyCard {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(deckId, "deckId");
        kind = kind == null ? CardKind.SIMPLE : kind;
        options = options == null ? List.of() : List.copyOf(options);
        if (kind == CardKind.CHOICE && options.isEmpty()) {
            throw new IllegalArgumentException("Choice card requires options: " + id);
        }
        if (kind == CardKind.SIMPLE && !options.isEmpty()) {
            throw new IllegalArgumentException("Simple card cannot carry options: " + id);
        }
    }

    public static StudyCard simple(UUID id, UUID deckId, String prompt, String answer, int position) {
        return new StudyCard(id, deckId, prompt, answer, null, null, CardKind.SIMPLE, List.of(), position);
    }

    public static StudyCard choice(UUID id, UUID deckId, String prompt, String answer, List<String> options, int position) {
        return new StudyCard(id, deckId, prompt, answer, null, null, CardKind.CHOICE, options, position);
    }
}
