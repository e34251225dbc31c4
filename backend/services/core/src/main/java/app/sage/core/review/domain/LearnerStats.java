package app.sage.core.review.domain;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public record LearnerStats(
        int currentStreak,
        int longestStreak,
        LocalDate lastStudyDate,
        long totalReviews,
        long reviewedToday,
        long studyTimeTodayMs,
        long newCardsToday,
        long sessionsToday,
        long dueNow,
        long dueTomorrow,
        double accuracy,
        Map<Rating, Long> ratingDistribution,
        int dailyGoal,
        double dailyGoalProgress,
        List<DailyActivity> recentDays
) {
    public record DailyActivity(LocalDate date, long reviews, long studyTimeMs) {
    }
}
