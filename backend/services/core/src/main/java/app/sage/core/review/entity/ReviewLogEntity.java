package app.sage.core.review.entity;

import app.sage.core.review.domain.ReviewSyncStatus;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "review_logs", schema = "app_core")
public class ReviewLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "card_id", nullable = false)
    private UUID cardId;

    @Column(name = "learner_id", nullable = false)
    private UUID learnerId;

    @Column(name = "deck_id", nullable = false)
    private UUID deckId;

    @Column(name = "algorithm_id", nullable = false)
    private String algorithmId;

    @Column(name = "rating", nullable = false)
    private short rating;

    @Column(name = "phase_at_review", nullable = false)
    private String phaseAtReview;

    @Column(name = "elapsed_days", nullable = false)
    private double elapsedDays;

    @Column(name = "scheduled_days", nullable = false)
    private double scheduledDays;

    @Column(name = "review_time_ms", nullable = false)
    private long reviewTimeMs;

    @Column(name = "reviewed_at", nullable = false)
    private Instant reviewedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "sync_status", nullable = false)
    private ReviewSyncStatus syncStatus;

    @Column(name = "sync_attempts", nullable = false)
    private int syncAttempts;

    @Column(name = "last_sync_error")
    private String lastSyncError;

    @Column(name = "synced_at")
    private Instant syncedAt;

    public Long getId() {
        return id;
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

    public short getRating() {
        return rating;
    }

    public void setRating(short rating) {
        this.rating = rating;
    }

    public String getPhaseAtReview() {
        return phaseAtReview;
    }

    public void setPhaseAtReview(String phaseAtReview) {
        this.phaseAtReview = phaseAtReview;
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

    public long getReviewTimeMs() {
        return reviewTimeMs;
    }

    public void setReviewTimeMs(long reviewTimeMs) {
        this.reviewTimeMs = reviewTimeMs;
    }

    public Instant getReviewedAt() {
        return reviewedAt;
    }

    public void setReviewedAt(Instant reviewedAt) {
        this.reviewedAt = reviewedAt;
    }

    public ReviewSyncStatus getSyncStatus() {
        return syncStatus;
    }

    public void setSyncStatus(ReviewSyncStatus syncStatus) {
        this.syncStatus = syncStatus;
    }

    public int getSyncAttempts() {
        return syncAttempts;
    }

    public void setSyncAttempts(int syncAttempts) {
        this.syncAttempts = syncAttempts;
    }

    public String getLastSyncError() {
        return lastSyncError;
    }

    public void setLastSyncError(String lastSyncError) {
        this.lastSyncError = lastSyncError;
    }

    public Instant getSyncedAt() {
        return syncedAt;
    }

    public void setSyncedAt(Instant syncedAt) {
        this.syncedAt = syncedAt;
    }
}
