package app.sage.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Application-wide scheduler defaults. Unset values fall back to the built-in defaults of
 * {@link app.sage.core.review.algorithm.SchedulerSettings}.
 */
@ConfigurationProperties(prefix = "app.scheduler")
public record SchedulerProps(
        Double requestRetention,
        Double maximumIntervalDays,
        Double graduatingIntervalDays,
        Double easyIntervalDays,
        Integer minimumIntervalMinutes,
        List<Integer> learningStepsMinutes,
        List<Integer> relearningStepsMinutes,
        Double masteryStabilityDays,
        List<Double> weights
) {
}
