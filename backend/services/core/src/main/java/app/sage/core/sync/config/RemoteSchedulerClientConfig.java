package app.sage.core.sync.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

import java.time.Duration;

@Configuration
@EnableConfigurationProperties(RemoteSchedulerProps.class)
public class RemoteSchedulerClientConfig {

    @Bean
    public RestClient remoteSchedulerRestClient(RestClient.Builder builder, RemoteSchedulerProps props) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofMillis(positiveOr(props.connectTimeoutMs(), 2000)));
        requestFactory.setReadTimeout(Duration.ofMillis(positiveOr(props.readTimeoutMs(), 5000)));
        return builder
                .baseUrl(props.baseUrl() == null ? "" : props.baseUrl())
                .requestFactory(requestFactory)
                .build();
    }

    @Bean(name = "reconciliationExecutor")
    public ThreadPoolTaskExecutor reconciliationExecutor(RemoteSchedulerProps props) {
        int threads = positiveOr(props.executorThreads(), 2);
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("review-reconcile-");
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(positiveOr(props.executorQueueCapacity(), 1000));
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }

    private static int positiveOr(Integer value, int fallback) {
        return value == null || value <= 0 ? fallback : value;
    }
}
