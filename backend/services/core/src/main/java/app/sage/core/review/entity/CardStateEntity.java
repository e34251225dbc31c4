package app.sage.core.review.entity;

import app.sage.core.review.domain.SyncStatus;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "card_states", schema = "app_core")
@IdClass(CardStateId.class)
public class CardStateEntity {

    @Id
    @Column(name = "card_id", nullable = false)
    private UUID cardId;

    @Id
    @Column(name = "learner_id", nullable = false)
    private UUID learnerId;

    @Column(name = "deck_id", nullable = false)
    private UUID deckId;

    @Column(name = "algorithm_id", nullable = false)
    private String algorithmId;

    @Column(name = "stability", nullable = false)
    private double stability;

    @Column(name = "difficulty", nullable = false)
    private double difficulty;

    @Column(name = "elapsed_days", nullable = false)
    private double elapsedDays;

    @Column(name = "scheduled_days", nullable = false)
    private double scheduledDays;

    @Column(name = "reps", nullable = false)
    private int reps;

    @Column(name = "lapses", nullable = false)
    private int lapses;

    // Stored as text; unknown values are treated as corrupt state on read.
    @Column(name = "phase", nullable = false)
    private String phase;

    @Column(name = "learning_step", nullable = false)
    private int learningStep;

    @Column(name = "due_at")
    private Instant dueAt;

    @Column(name = "last_review_at")
    private Instant lastReviewAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "sync_status", nullable = false)
    private SyncStatus syncStatus;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "row_version", nullable = false)
    private long rowVersion;

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

    public UUID getDeckId() {
        return deckId;
    }

    public void setDeckId(UUID deckId) {
        this.deckId = deckId;
    }

    public String getAlgorithmId() {
        return algorithmId;
    }

    public void setAlgorithmId(String algorithmId) {
        this.algorithmId = algorithmId;
    }

    public double getStability() {
        return stability;
    }

    public void setStability(double stability) {
        this.stability = stability;
    }

    public double getDifficulty() {
        return difficulty;
    }

    public void setDifficulty(double difficulty) {
        this.difficulty = difficulty;
    }

    public double getElapsedDays() {
        return elapsedDays;
    }

    public void setElapsedDays(double elapsedDays) {
        this.elapsedDays = elapsedDays;
    }

    public double getScheduledDays() {
        return scheduledDays;
    }

    public void setScheduledDays(double scheduledDays) {
        this.scheduledDays = scheduledDays;
    }

    public int getReps() {
        return reps;
    }

    public void setReps(int reps) {
        this.reps = reps;
    }

    public int getLapses() {
        return lapses;
    }

    public void setLapses(int lapses) {
        this.lapses = lapses;
    }

    public String getPhase() {
        return phase;
    }

    public void setPhase(String phase) {
        this.phase = phase;
    }

    public int getLearningStep() {
        return learningStep;
    }

    public void setLearningStep(int learningStep) {
        this.learningStep = learningStep;
    }

    public Instant getDueAt() {
        return dueAt;
    }

    public void setDueAt(Instant dueAt) {
        this.dueAt = dueAt;
    }

    public Instant getLastReviewAt() {
        return lastReviewAt;
    }

    public void setLastReviewAt(Instant lastReviewAt) {
        this.lastReviewAt = lastReviewAt;
    }

    public SyncStatus getSyncStatus() {
        return syncStatus;
    }

    public void setSyncStatus(SyncStatus syncStatus) {
        this.syncStatus = syncStatus;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public long getRowVersion() {
        return rowVersion;
    }
}
