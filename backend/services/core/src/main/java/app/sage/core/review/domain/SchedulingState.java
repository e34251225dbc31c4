package app.sage.core.review.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Memory-model belief about one card for one learner.
 *
 * <p>{@code learningStep} indexes the learning or relearning step list and is 0 in the
 * {@link CardPhase#NEW} and {@link CardPhase#REVIEW} phases.
 */
public record SchedulingState(
        double stability,
        double difficulty,
        double elapsedDays,
        double scheduledDays,
        int reps,
        int lapses,
        CardPhase phase,
        int learningStep,
        Instant due,
        Instant lastReview
) {
    public static final double NEW_CARD_STABILITY = 1.0;
    public static final double NEW_CARD_DIFFICULTY = 5.0;

    public SchedulingState {
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(due, "due");
    }

    public static SchedulingState newCard(Instant now) {
        return new SchedulingState(NEW_CARD_STABILITY, NEW_CARD_DIFFICULTY, 0.0, 0.0, 0, 0,
                CardPhase.NEW, 0, now, null);
    }

    public boolean isDue(Instant now) {
        return !due.isAfter(now);
    }

    public SchedulingState withSchedule(double scheduledDays, Instant due) {
        return new SchedulingState(stability, difficulty, elapsedDays, scheduledDays, reps, lapses,
                phase, learningStep, due, lastReview);
    }

    /**
     * Overlays an authoritative result. Missing remote fields keep the local value; counters and
     * the review timestamp are local facts and are never taken from the remote side.
     */
    public SchedulingState withAuthoritative(AuthoritativeState remote) {
        double s = remote.stability() != null && remote.stability() > 0 ? remote.stability() : stability;
        double d = remote.difficulty() != null && remote.difficulty() > 0 ? remote.difficulty() : difficulty;
        CardPhase p = remote.phase() != null ? remote.phase() : phase;
        Instant nextDue = remote.due() != null ? remote.due() : due;
        if (lastReview != null && nextDue.isBefore(lastReview)) {
            nextDue = lastReview;
        }
        double scheduled = lastReview == null
                ? scheduledDays
                : Duration.between(lastReview, nextDue).toSeconds() / 86400.0;
        int step = p == phase ? learningStep : 0;
        return new SchedulingState(s, d, elapsedDays, scheduled, reps, lapses, p, step, nextDue, lastReview);
    }
}
