package app.sage.core.review.service;

import app.sage.core.review.algorithm.SchedulerSettings;
import app.sage.core.review.api.CardCatalogPort;
import app.sage.core.review.domain.DeckStats;
import app.sage.core.review.domain.LearnerStats;
import app.sage.core.review.domain.StudyHistory;
import app.sage.core.review.service.LearnerPreferencesService.LearnerPreferences;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.UUID;

@Service
public class StudyStatsService {

    static final int DEFAULT_HISTORY_DAYS = 52 * 7;
    static final int MAX_HISTORY_DAYS = 3 * 366;

    private final SchedulingStateStore store;
    private final ReviewLogService reviewLog;
    private final StudySessionLogService sessionLog;
    private final LearnerPreferencesService preferences;
    private final CardCatalogPort cardCatalog;
    private final StudyStatsCalculator calculator;
    private final Clock clock;

    public StudyStatsService(SchedulingStateStore store,
                             ReviewLogService reviewLog,
                             StudySessionLogService sessionLog,
                             LearnerPreferencesService preferences,
                             CardCatalogPort cardCatalog,
                             StudyStatsCalculator calculator,
                             Clock clock) {
        this.store = store;
        this.reviewLog = reviewLog;
        this.sessionLog = sessionLog;
        this.preferences = preferences;
        this.cardCatalog = cardCatalog;
        this.calculator = calculator;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public DeckStats deckStats(UUID learnerId, UUID deckId) {
        Instant now = clock.instant();
        LearnerPreferences prefs = preferences.get(learnerId);
        SchedulerSettings settings = preferences.settingsFor(learnerId);
        long introducedToday = reviewLog.countNewCardsIntroducedSince(learnerId, startOfDay(now, prefs.timeZone()));
        long remainingQuota = Math.max(0, prefs.newCardsPerDay() - introducedToday);
        return calculator.deckStats(
                deckId,
                cardCatalog.countDeckCards(deckId),
                store.loadDeckStates(learnerId, deckId),
                remainingQuota,
                settings.masteryStabilityDays(),
                now
        );
    }

    @Transactional(readOnly = true)
    public LearnerStats learnerStats(UUID learnerId) {
        Instant now = clock.instant();
        LearnerPreferences prefs = preferences.get(learnerId);
        ZoneId zone = prefs.timeZone();
        return calculator.learnerStats(
                reviewLog.history(learnerId),
                store.loadLearnerStates(learnerId),
                zone,
                now,
                prefs.dailyGoal(),
                sessionLog.countSessionsSince(learnerId, startOfDay(now, zone))
        );
    }

    /**
     * Daily records between {@code from} and {@code to}, inclusive, in the learner's time zone.
     * Missing bounds default to the last {@value #DEFAULT_HISTORY_DAYS} days ending today.
     */
    @Transactional(readOnly = true)
    public StudyHistory history(UUID learnerId, LocalDate from, LocalDate to) {
        ZoneId zone = preferences.get(learnerId).timeZone();
        LocalDate today = LocalDate.ofInstant(clock.instant(), zone);
        LocalDate end = to == null ? today : to;
        LocalDate start = from == null ? end.minusDays(DEFAULT_HISTORY_DAYS - 1) : from;
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("from must not be after to");
        }
        if (start.plusDays(MAX_HISTORY_DAYS).isBefore(end)) {
            throw new IllegalArgumentException("History range is limited to " + MAX_HISTORY_DAYS + " days");
        }
        return calculator.history(
                reviewLog.history(learnerId),
                sessionLog.sessionEndTimes(learnerId),
                zone,
                start,
                end,
                today
        );
    }

    private static Instant startOfDay(Instant now, ZoneId zone) {
        return LocalDate.ofInstant(now, zone).atStartOfDay(zone).toInstant();
    }
}
