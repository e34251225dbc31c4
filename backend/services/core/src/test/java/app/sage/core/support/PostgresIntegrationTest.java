package app.sage.core.support;

import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

/**
 * Points the context at a local Postgres. Test classes are skipped, before any context is
 * built, when none is reachable.
 */
@ExtendWith(PostgresAvailableCondition.class)
public abstract class PostgresIntegrationTest {

    static final String URL = firstNonBlank(System.getenv("SPRING_DATASOURCE_URL"), "jdbc:postgresql://localhost:5432/sage");
    static final String USERNAME = firstNonBlank(System.getenv("SPRING_DATASOURCE_USERNAME"), System.getenv("POSTGRES_USER"), "sage");
    static final String PASSWORD = firstNonBlank(System.getenv("SPRING_DATASOURCE_PASSWORD"), System.getenv("POSTGRES_PASSWORD"), "");

    @DynamicPropertySource
    static void configureDataSource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", () -> URL);
        registry.add("spring.datasource.username", () -> USERNAME);
        registry.add("spring.datasource.password", () -> PASSWORD);
        registry.add("spring.flyway.url", () -> URL);
        registry.add("spring.flyway.user", () -> USERNAME);
        registry.add("spring.flyway.password", () -> PASSWORD);
    }

    private static String firstNonBlank(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isBlank()) {
                return candidate;
            }
        }
        return "";
    }
}
