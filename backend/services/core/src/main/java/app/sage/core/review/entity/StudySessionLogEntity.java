package app.sage.core.review.entity;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "study_session_logs", schema = "app_core")
public class StudySessionLogEntity {

    @Id
    @Column(name = "session_id", nullable = false)
    private UUID sessionId;

    @Column(name = "learner_id", nullable = false)
    private UUID learnerId;

    @Column(name = "deck_id", nullable = false)
    private UUID deckId;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "ended_at", nullable = false)
    private Instant endedAt;

    @Column(name = "duration_ms", nullable = false)
    private long durationMs;

    @Column(name = "cards_total", nullable = false)
    private int cardsTotal;

    @Column(name = "cards_reviewed", nullable = false)
    private int cardsReviewed;

    @Column(name = "cards_correct", nullable = false)
    private int cardsCorrect;

    @Column(name = "completed", nullable = false)
    private boolean completed;

    public UUID getSessionId() {
        return sessionId;
    }

    public void setSessionId(UUID sessionId) {
        this.sessionId = sessionId;
    }

    public UUID getLearnerId() {
        return learnerId;
    }

    public void setLearnerId(UUID learnerId) {
        this.learnerId = learnerId;
    }

    public UUID getDeckId() {
        return deckId;
    }

    public void setDeckId(UUID deckId) {
        this.deckId = deckId;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getEndedAt() {
        return endedAt;
    }

    public void setEndedAt(Instant endedAt) {
        this.endedAt = endedAt;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public void setDurationMs(long durationMs) {
        this.durationMs = durationMs;
    }

    public int getCardsTotal() {
        return cardsTotal;
    }

    public void setCardsTotal(int cardsTotal) {
        this.cardsTotal = cardsTotal;
    }

    public int getCardsReviewed() {
        return cardsReviewed;
    }

    public void setCardsReviewed(int cardsReviewed) {
        this.cardsReviewed = cardsReviewed;
    }

    public int getCardsCorrect() {
        return cardsCorrect;
    }

    public void setCardsCorrect(int cardsCorrect) {
        this.cardsCorrect = cardsCorrect;
    }

    public boolean isCompleted() {
        return completed;
    }

    public void setCompleted(boolean completed) {
        this.completed = completed;
    }
}
