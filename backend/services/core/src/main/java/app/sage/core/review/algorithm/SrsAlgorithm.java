package app.sage.core.review.algorithm;

import app.sage.core.review.domain.Rating;
import app.sage.core.review.domain.SchedulingState;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

public interface SrsAlgorithm {

    String id();

    SchedulingState initialState(Instant now);

    /**
     * Computes the state that follows {@code state} when the learner answers with {@code rating}
     * at {@code now}. Implementations are pure and clamp every value they produce.
     */
    SchedulingState apply(SchedulingState state, Rating rating, Instant now, SchedulerSettings settings);

    default Map<Rating, SchedulingState> candidates(SchedulingState state, Instant now, SchedulerSettings settings) {
        Map<Rating, SchedulingState> out = new EnumMap<>(Rating.class);
        for (Rating r : Rating.values()) {
            out.put(r, apply(state, r, now, settings));
        }
        return out;
    }
}
