package app.sage.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.study")
public record StudyProps(
        Integer defaultSessionSize,
        Integer maxSessionSize,
        Integer defaultNewCardsPerDay,
        Integer defaultDailyGoal,
        String defaultTimeZone
) {
    public int sessionSizeOrDefault() {
        return defaultSessionSize == null || defaultSessionSize <= 0 ? 20 : defaultSessionSize;
    }

    public int maxSessionSizeOrDefault() {
        return maxSessionSize == null || maxSessionSize <= 0 ? 200 : maxSessionSize;
    }

    public int newCardsPerDayOrDefault() {
        return defaultNewCardsPerDay == null || defaultNewCardsPerDay < 0 ? 20 : defaultNewCardsPerDay;
    }

    public int dailyGoalOrDefault() {
        return defaultDailyGoal == null || defaultDailyGoal < 0 ? 50 : defaultDailyGoal;
    }

    public String timeZoneOrDefault() {
        return defaultTimeZone == null || defaultTimeZone.isBlank() ? "UTC" : defaultTimeZone;
    }
}
