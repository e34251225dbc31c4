package app.sage.core.review.entity;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "learner_preferences", schema = "app_core")
public class LearnerPreferencesEntity {

    @Id
    @Column(name = "learner_id", nullable = false)
    private UUID learnerId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "scheduler_overrides", columnDefinition = "jsonb")
    private JsonNode schedulerOverrides;

    @Column(name = "new_cards_per_day", nullable = false)
    private int newCardsPerDay;

    @Column(name = "daily_goal", nullable = false)
    private int dailyGoal;

    @Column(name = "time_zone", nullable = false)
    private String timeZone;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "row_version", nullable = false)
    private long rowVersion;

    public UUID getLearnerId() {
        return learnerId;
    }

    public void setLearnerId(UUID learnerId) {
        this.learnerId = learnerId;
    }

    public JsonNode getSchedulerOverrides() {
        return schedulerOverrides;
    }

    public void setSchedulerOverrides(JsonNode schedulerOverrides) {
        this.schedulerOverrides = schedulerOverrides;
    }

    public int getNewCardsPerDay() {
        return newCardsPerDay;
    }

    public void setNewCardsPerDay(int newCardsPerDay) {
        this.newCardsPerDay = newCardsPerDay;
    }

    public int getDailyGoal() {
        return dailyGoal;
    }

    public void setDailyGoal(int dailyGoal) {
        this.dailyGoal = dailyGoal;
    }

    public String getTimeZone() {
        return timeZone;
    }

    public void setTimeZone(String timeZone) {
        this.timeZone = timeZone;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
