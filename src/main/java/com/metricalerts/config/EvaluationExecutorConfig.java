package com.metricalerts.config;

import com.metricalerts.evaluation.AlertEvaluationConfig;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded worker pool for per-rule evaluation.
 *
 * <p>Core and max size are equal so the pool never grows past the store's connection
 * budget. When the queue is full the submitting thread evaluates the rule itself, which
 * throttles the run instead of rejecting rules. Once the pool is shut down submissions are
 * rejected with an exception rather than dropped, so no caller waits on a task that never runs.
 */
@Configuration
@EnableConfigurationProperties(AlertEvaluationConfig.class)
public class EvaluationExecutorConfig {

    public static final String EVALUATION_EXECUTOR = "alertEvaluationExecutor";

    static final RejectedExecutionHandler RUN_INLINE_OR_REJECT = (task, pool) -> {
        if (pool.isShutdown()) {
            throw new RejectedExecutionException("Alert evaluation executor is shut down");
        }
        task.run();
    };

    @Bean(EVALUATION_EXECUTOR)
    public ThreadPoolTaskExecutor alertEvaluationExecutor(AlertEvaluationConfig alertEvaluationConfig) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(alertEvaluationConfig.getWorkerPoolSize());
        executor.setMaxPoolSize(alertEvaluationConfig.getWorkerPoolSize());
        executor.setQueueCapacity(alertEvaluationConfig.getQueueCapacity());
        executor.setThreadNamePrefix("alert-eval-");
        executor.setRejectedExecutionHandler(RUN_INLINE_OR_REJECT);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
