package info.mouts.foodorders.config;

import java.util.Map;

import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import lombok.extern.slf4j.Slf4j;

/**
 * Executor running the writers of live order feed sessions. Every open
 * session holds one thread, so the pool size bounds the number of concurrent
 * feed connections.
 */
@Configuration
@Slf4j
public class FeedExecutorConfig {

    @Value("${app.feed.max-sessions:64}")
    private int maxSessions;

    @Bean("orderFeedExecutor")
    public ThreadPoolTaskExecutor orderFeedExecutor() {
        log.info("Creating order feed executor for up to {} sessions", maxSessions);

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.min(4, maxSessions));
        executor.setMaxPoolSize(maxSessions);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("order-feed-");
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    private static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            final Map<String, String> context = MDC.getCopyOfContextMap();
            return () -> {
                if (context != null) {
                    MDC.setContextMap(context);
                }
                try {
                    runnable.run();
                } finally {
                    MDC.clear();
                }
            };
        };
    }
}
