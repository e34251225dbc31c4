package app.sage.core.review.service;

import app.sage.core.review.domain.CardPhase;
import app.sage.core.review.domain.DeckStats;
import app.sage.core.review.domain.LearnerStats;
import app.sage.core.review.domain.LearnerStats.DailyActivity;
import app.sage.core.review.domain.Rating;
import app.sage.core.review.domain.ReviewRecord;
import app.sage.core.review.domain.SchedulingState;
import app.sage.core.review.domain.StudyHistory;
import app.sage.core.review.domain.StudyHistory.DailyStudyRecord;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.*;

/**
 * Projections over scheduling states and the review log. Holds no state of its own.
 */
@Component
public class StudyStatsCalculator {

    static final int RECENT_DAYS = 7;

    /**
     * @param totalCards        cards in the deck; cards without a scheduling record count as new
     * @param remainingNewQuota new cards the learner may still start today
     */
    public DeckStats deckStats(UUID deckId,
                               long totalCards,
                               Collection<SchedulingState> states,
                               long remainingNewQuota,
                               double masteryStabilityDays,
                               Instant now) {
        long learning = 0;
        long review = 0;
        long relearning = 0;
        long due = 0;
        long mastered = 0;
        for (SchedulingState s : states) {
            switch (s.phase()) {
                case LEARNING -> learning++;
                case REVIEW -> review++;
                case RELEARNING -> relearning++;
                case NEW -> {
                    continue;
                }
            }
            if (s.isDue(now)) {
                due++;
            }
            if (isMastered(s, masteryStabilityDays)) {
                mastered++;
            }
        }
        long started = learning + review + relearning;
        long total = Math.max(totalCards, started);
        long newCards = total - started;
        long newAvailable = Math.min(newCards, Math.max(0, remainingNewQuota));
        double ratio = total == 0 ? 0.0 : (double) mastered / total;
        return new DeckStats(deckId, total, newCards, learning, review, relearning, due, newAvailable, mastered, ratio);
    }

    public LearnerStats learnerStats(List<ReviewRecord> history,
                                     Collection<SchedulingState> states,
                                     ZoneId zone,
                                     Instant now,
                                     int dailyGoal,
                                     long sessionsToday) {
        LocalDate today = LocalDate.ofInstant(now, zone);
        Instant tomorrowStart = today.plusDays(1).atStartOfDay(zone).toInstant();
        Instant dayAfterStart = today.plusDays(2).atStartOfDay(zone).toInstant();

        Map<Rating, Long> distribution = emptyDistribution();
        TreeMap<LocalDate, long[]> byDay = new TreeMap<>();
        Set<UUID> newToday = new HashSet<>();
        long correct = 0;
        for (ReviewRecord r : history) {
            distribution.merge(r.rating(), 1L, Long::sum);
            if (r.rating().isCorrect()) {
                correct++;
            }
            LocalDate day = LocalDate.ofInstant(r.reviewedAt(), zone);
            long[] agg = byDay.computeIfAbsent(day, d -> new long[2]);
            agg[0]++;
            agg[1] += Math.max(0, r.reviewTimeMs());
            if (day.equals(today) && r.phaseAtReview() == CardPhase.NEW) {
                newToday.add(r.cardId());
            }
        }

        long dueNow = 0;
        long dueTomorrow = 0;
        for (SchedulingState s : states) {
            if (s.phase() == CardPhase.NEW) {
                continue;
            }
            if (s.isDue(now)) {
                dueNow++;
            } else if (!s.due().isBefore(tomorrowStart) && s.due().isBefore(dayAfterStart)) {
                dueTomorrow++;
            }
        }

        long[] todayAgg = byDay.getOrDefault(today, new long[2]);
        int[] streaks = streaks(byDay.navigableKeySet(), today);
        double accuracy = history.isEmpty() ? 0.0 : round2((double) correct / history.size());
        double goalProgress = dailyGoal <= 0
                ? 100.0
                : Math.min(100.0, round2(todayAgg[0] * 100.0 / dailyGoal));

        List<DailyActivity> recent = new ArrayList<>(RECENT_DAYS);
        for (int i = RECENT_DAYS - 1; i >= 0; i--) {
            LocalDate day = today.minusDays(i);
            long[] agg = byDay.getOrDefault(day, new long[2]);
            recent.add(new DailyActivity(day, agg[0], agg[1]));
        }

        return new LearnerStats(
                streaks[0],
                streaks[1],
                byDay.isEmpty() ? null : byDay.lastKey(),
                history.size(),
                todayAgg[0],
                todayAgg[1],
                newToday.size(),
                sessionsToday,
                dueNow,
                dueTomorrow,
                accuracy,
                distribution,
                dailyGoal,
                goalProgress,
                recent
        );
    }

    /**
     * Rebuilds daily study records from the review log and finished sessions. A day's study time
     * is the sum of its review times.
     */
    public StudyHistory history(List<ReviewRecord> reviews,
                                List<Instant> sessionEnds,
                                ZoneId zone,
                                LocalDate from,
                                LocalDate to,
                                LocalDate today) {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("from must not be after to");
        }
        TreeMap<LocalDate, DayAccumulator> byDay = new TreeMap<>();
        Map<Rating, Long> totalRatings = emptyDistribution();
        long totalTime = 0;
        for (ReviewRecord r : reviews) {
            long time = Math.max(0, r.reviewTimeMs());
            DayAccumulator day = byDay.computeIfAbsent(LocalDate.ofInstant(r.reviewedAt(), zone), d -> new DayAccumulator());
            day.cards++;
            day.timeMs += time;
            day.ratings.merge(r.rating(), 1L, Long::sum);
            totalRatings.merge(r.rating(), 1L, Long::sum);
            totalTime += time;
        }
        TreeSet<LocalDate> reviewDays = new TreeSet<>(byDay.keySet());
        for (Instant endedAt : sessionEnds) {
            byDay.computeIfAbsent(LocalDate.ofInstant(endedAt, zone), d -> new DayAccumulator()).sessions++;
        }

        List<DailyStudyRecord> days = new ArrayList<>();
        for (Map.Entry<LocalDate, DayAccumulator> e : byDay.subMap(from, true, to, true).entrySet()) {
            DayAccumulator day = e.getValue();
            days.add(new DailyStudyRecord(e.getKey(), day.cards, day.timeMs, day.ratings, day.sessions));
        }

        int[] streaks = streaks(reviewDays, today);
        StudyHistory.Overall overall = new StudyHistory.Overall(
                reviews.size(),
                totalTime,
                totalRatings,
                streaks[0],
                streaks[1],
                reviewDays.isEmpty() ? null : reviewDays.first(),
                reviewDays.isEmpty() ? null : reviewDays.last()
        );
        return new StudyHistory(from, to, days, overall);
    }

    public static boolean isMastered(SchedulingState state, double masteryStabilityDays) {
        return state.phase() == CardPhase.REVIEW && state.stability() > masteryStabilityDays;
    }

    /**
     * @return {current, longest}; the current streak only counts when its last day is today or yesterday
     */
    static int[] streaks(NavigableSet<LocalDate> days, LocalDate today) {
        if (days.isEmpty()) {
            return new int[]{0, 0};
        }
        int longest = 0;
        int run = 0;
        LocalDate previous = null;
        for (LocalDate day : days) {
            run = previous != null && previous.plusDays(1).equals(day) ? run + 1 : 1;
            longest = Math.max(longest, run);
            previous = day;
        }
        LocalDate last = days.last();
        boolean active = last.equals(today) || last.equals(today.minusDays(1));
        return new int[]{active ? run : 0, longest};
    }

    private static Map<Rating, Long> emptyDistribution() {
        Map<Rating, Long> out = new EnumMap<>(Rating.class);
        for (Rating r : Rating.values()) {
            out.put(r, 0L);
        }
        return out;
    }

    private static final class DayAccumulator {
        long cards;
        long timeMs;
        long sessions;
        final Map<Rating, Long> ratings = emptyDistribution();
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
