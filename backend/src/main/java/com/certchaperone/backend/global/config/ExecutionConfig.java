package com.certchaperone.backend.global.config;

import java.util.Map;

import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded pool that runs concurrent admin reads.
 */
@Configuration
public class ExecutionConfig {

    public static final String ADMIN_QUERY_EXECUTOR = "adminQueryExecutor";

    /**
     * Pool for overview counts and enrichment lookups. Submissions beyond the bounded queue are rejected.
     */
    @Bean(name = ADMIN_QUERY_EXECUTOR)
    public ThreadPoolTaskExecutor adminQueryExecutor(
            @Value("${app.admin.executor.core-size:10}") int coreSize,
            @Value("${app.admin.executor.max-size:20}") int maxSize,
            @Value("${app.admin.executor.queue-capacity:200}") int queueCapacity
    ) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("admin-query-");
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }

    private TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> context = MDC.getCopyOfContextMap();
            return () -> {
                Map<String, String> previous = MDC.getCopyOfContextMap();
                if (context != null) {
                    MDC.setContextMap(context);
                } else {
                    MDC.clear();
                }
                try {
                    runnable.run();
                } finally {
                    if (previous != null) {
                        MDC.setContextMap(previous);
                    } else {
                        MDC.clear();
                    }
                }
            };
        };
    }
}
