package app.sage.core.review.service;

import app.sage.core.config.StudyProps;
import app.sage.core.review.algorithm.SchedulerSettings;
import app.sage.core.review.entity.LearnerPreferencesEntity;
import app.sage.core.review.repository.LearnerPreferencesRepository;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.UUID;

@Service
public class LearnerPreferencesService {

    private static final int MAX_NEW_CARDS_PER_DAY = 9999;
    private static final int MAX_DAILY_GOAL = 9999;

    private final LearnerPreferencesRepository repository;
    private final SchedulerSettingsResolver settingsResolver;
    private final StudyProps studyProps;
    private final Clock clock;

    public LearnerPreferencesService(LearnerPreferencesRepository repository,
                                     SchedulerSettingsResolver settingsResolver,
                                     StudyProps studyProps,
                                     Clock clock) {
        this.repository = repository;
        this.settingsResolver = settingsResolver;
        this.studyProps = studyProps;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public LearnerPreferences get(UUID learnerId) {
        return repository.findById(learnerId)
                .map(this::toSnapshot)
                .orElseGet(() -> defaults(learnerId));
    }

    @Transactional(readOnly = true)
    public SchedulerSettings settingsFor(UUID learnerId) {
        return settingsResolver.resolve(get(learnerId).schedulerOverrides());
    }

    /**
     * Partial update: {@code null} arguments keep the stored value.
     */
    @Transactional
    public LearnerPreferences update(UUID learnerId,
                                     JsonNode schedulerOverrides,
                                     Integer newCardsPerDay,
                                     Integer dailyGoal,
                                     String timeZone) {
        if (schedulerOverrides != null && !schedulerOverrides.isNull() && !schedulerOverrides.isObject()) {
            throw new IllegalArgumentException("schedulerOverrides must be a JSON object");
        }
        if (newCardsPerDay != null && (newCardsPerDay < 0 || newCardsPerDay > MAX_NEW_CARDS_PER_DAY)) {
            throw new IllegalArgumentException("newCardsPerDay must be between 0 and " + MAX_NEW_CARDS_PER_DAY);
        }
        if (dailyGoal != null && (dailyGoal < 0 || dailyGoal > MAX_DAILY_GOAL)) {
            throw new IllegalArgumentException("dailyGoal must be between 0 and " + MAX_DAILY_GOAL);
        }
        ZoneId zone = timeZone == null ? null : parseZone(timeZone);

        LearnerPreferencesEntity entity = repository.findById(learnerId)
                .orElseGet(() -> createDefaultWithRetry(learnerId));
        if (schedulerOverrides != null) {
            entity.setSchedulerOverrides(schedulerOverrides.isNull() ? null : schedulerOverrides);
        }
        if (newCardsPerDay != null) {
            entity.setNewCardsPerDay(newCardsPerDay);
        }
        if (dailyGoal != null) {
            entity.setDailyGoal(dailyGoal);
        }
        if (zone != null) {
            entity.setTimeZone(zone.getId());
        }
        entity.setUpdatedAt(clock.instant());
        return toSnapshot(repository.save(entity));
    }

    private LearnerPreferencesEntity createDefaultWithRetry(UUID learnerId) {
        try {
            return repository.saveAndFlush(buildDefault(learnerId));
        } catch (DataIntegrityViolationException ex) {
            return repository.findById(learnerId).orElseThrow(() -> ex);
        }
    }

    private LearnerPreferencesEntity buildDefault(UUID learnerId) {
        Instant now = clock.instant();
        LearnerPreferencesEntity entity = new LearnerPreferencesEntity();
        entity.setLearnerId(learnerId);
        entity.setSchedulerOverrides(null);
        entity.setNewCardsPerDay(studyProps.newCardsPerDayOrDefault());
        entity.setDailyGoal(studyProps.dailyGoalOrDefault());
        entity.setTimeZone(parseZone(studyProps.timeZoneOrDefault()).getId());
        entity.setCreatedAt(now);
        entity.setUpdatedAt(now);
        return entity;
    }

    private LearnerPreferences defaults(UUID learnerId) {
        return new LearnerPreferences(
                learnerId,
                null,
                studyProps.newCardsPerDayOrDefault(),
                studyProps.dailyGoalOrDefault(),
                parseZone(studyProps.timeZoneOrDefault())
        );
    }

    private LearnerPreferences toSnapshot(LearnerPreferencesEntity entity) {
        ZoneId zone;
        try {
            zone = ZoneId.of(entity.getTimeZone());
        } catch (DateTimeException ex) {
            zone = parseZone(studyProps.timeZoneOrDefault());
        }
        return new LearnerPreferences(
                entity.getLearnerId(),
                entity.getSchedulerOverrides(),
                entity.getNewCardsPerDay(),
                entity.getDailyGoal(),
                zone
        );
    }

    private static ZoneId parseZone(String timeZone) {
        try {
            return ZoneId.of(timeZone.trim());
        } catch (DateTimeException ex) {
            throw new IllegalArgumentException("Unknown time zone: " + timeZone);
        }
    }

    public record LearnerPreferences(UUID learnerId,
                                     JsonNode schedulerOverrides,
                                     int newCardsPerDay,
                                     int dailyGoal,
                                     ZoneId timeZone) {
    }
}
