package app.sage.core.review.algorithm;

import app.sage.core.review.domain.IntervalPreview;
import app.sage.core.review.domain.Rating;
import app.sage.core.review.domain.ScheduleResult;
import app.sage.core.review.domain.SchedulingState;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Turns the per-rating candidates of an {@link SrsAlgorithm} into previews and committed states.
 *
 * <p>Candidates are made monotonic in scheduled days (again &lt;= hard &lt;= good &lt;= easy) before
 * anything is returned, and the committed state is always the candidate of the chosen rating.
 */
@Component
public class ReviewScheduler {

    private final SrsAlgorithm algorithm;

    public ReviewScheduler(SrsAlgorithm algorithm) {
        this.algorithm = algorithm;
    }

    public String algorithmId() {
        return algorithm.id();
    }

    public SchedulingState initialState(Instant now) {
        return algorithm.initialState(now);
    }

    public ScheduleResult computeUpdate(SchedulingState state, Rating rating, Instant now, SchedulerSettings settings) {
        Map<Rating, SchedulingState> candidates = orderedCandidates(state, now, settings);
        return new ScheduleResult(candidates.get(rating), toPreviews(candidates));
    }

    public Map<Rating, IntervalPreview> preview(SchedulingState state, Instant now, SchedulerSettings settings) {
        return toPreviews(orderedCandidates(state, now, settings));
    }

    private Map<Rating, SchedulingState> orderedCandidates(SchedulingState state, Instant now, SchedulerSettings settings) {
        Map<Rating, SchedulingState> raw = algorithm.candidates(state, now, settings);
        Map<Rating, SchedulingState> out = new EnumMap<>(Rating.class);
        SchedulingState previous = null;
        for (Rating r : Rating.values()) {
            SchedulingState c = raw.get(r);
            if (c == null) {
                throw new IllegalStateException("Algorithm " + algorithm.id() + " produced no candidate for " + r);
            }
            if (previous != null && c.scheduledDays() < previous.scheduledDays()) {
                c = c.withSchedule(previous.scheduledDays(), due(now, previous.scheduledDays()));
            }
            out.put(r, c);
            previous = c;
        }
        return out;
    }

    private static Map<Rating, IntervalPreview> toPreviews(Map<Rating, SchedulingState> candidates) {
        Map<Rating, IntervalPreview> out = new EnumMap<>(Rating.class);
        candidates.forEach((r, s) -> out.put(r, new IntervalPreview(r, s.phase(), s.scheduledDays(), s.due())));
        return out;
    }

    static Instant due(Instant now, double days) {
        return now.plus(Duration.ofSeconds(Math.round(days * 86400)));
    }
}
