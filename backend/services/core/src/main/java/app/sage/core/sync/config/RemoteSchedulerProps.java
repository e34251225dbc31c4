package app.sage.core.sync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.remote-scheduler")
public record RemoteSchedulerProps(
        boolean enabled,
        String baseUrl,
        String internalToken,
        Integer connectTimeoutMs,
        Integer readTimeoutMs,
        Integer maxAttempts,
        Integer batchSize,
        Integer executorThreads,
        Integer executorQueueCapacity
) {
    public int maxAttemptsOrDefault() {
        return maxAttempts == null || maxAttempts <= 0 ? 10 : maxAttempts;
    }

    public int batchSizeOrDefault() {
        return batchSize == null || batchSize <= 0 ? 100 : batchSize;
    }
}
