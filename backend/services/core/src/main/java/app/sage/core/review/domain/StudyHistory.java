package app.sage.core.review.domain;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Per-day study activity of one learner, bucketed by local date in the learner's time zone.
 *
 * @param days    days with at least one review or finished session inside {@code [from, to]}, oldest first
 * @param overall totals over the whole history, not only the requested range
 */
public record StudyHistory(
        LocalDate from,
        LocalDate to,
        List<DailyStudyRecord> days,
        Overall overall
) {
    public record DailyStudyRecord(
            LocalDate date,
            long cardsStudied,
            long studyTimeMs,
            Map<Rating, Long> ratings,
            long sessions
    ) {
    }

    public record Overall(
            long totalCardsStudied,
            long totalStudyTimeMs,
            Map<Rating, Long> totalRatings,
            int currentStreak,
            int longestStreak,
            LocalDate firstStudyDate,
            LocalDate lastStudyDate
    ) {
    }
}
