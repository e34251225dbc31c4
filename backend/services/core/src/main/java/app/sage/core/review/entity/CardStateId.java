package app.sage.core.review.entity;

import java.io.Serializable;
import java.util.Objects;
import java.util.UUID;

public class CardStateId implements Serializable {
    private UUID cardId;
    private UUID learnerId;

    public CardStateId() {}

    public CardStateId(UUID cardId, UUID learnerId) {
        this.cardId = cardId;
        this.learnerId = learnerId;
    }

    public UUID getCardId() {
        return cardId;
    }

    public void setCardId(UUID cardId) {
        this.cardId = cardId;
    }

    public UUID getLearnerId() {
        return learnerId;
    }

    public void setLearnerId(UUID learnerId) {
        this.learnerId = learnerId;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        CardStateId that = (CardStateId) o;
        return Objects.equals(cardId, that.cardId) && Objects.equals(learnerId, that.learnerId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cardId, learnerId);
    }
}
