package app.sage.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Browser origins of the study clients.
 *
 * @param maxAgeSeconds how long a preflight answer may be cached
 */
@ConfigurationProperties(prefix = "app.cors")
public record CorsProps(
        List<String> origins,
        Long maxAgeSeconds
) {
    public List<String> originsOrDefault() {
        return origins == null || origins.isEmpty()
                ? List.of("http://localhost:8081", "http://localhost:19006")
                : origins;
    }

    public long maxAgeOrDefault() {
        return maxAgeSeconds == null || maxAgeSeconds < 0 ? 3600L : maxAgeSeconds;
    }
}
