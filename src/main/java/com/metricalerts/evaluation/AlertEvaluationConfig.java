package com.metricalerts.evaluation;

import java.math.BigDecimal;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for alert evaluation under the {@code alert-evaluation} prefix.
 *
 * <ul>
 *   <li>{@code enabled} -- master toggle; a disabled engine answers every run with zero results</li>
 *   <li>{@code workerPoolSize} -- concurrent rule evaluations; keep at or below the store's
 *       connection pool size since every rule holds a connection per round-trip</li>
 *   <li>{@code queueCapacity} -- rules queued behind busy workers before callers run inline</li>
 *   <li>{@code triggeredBy} -- value written to the {@code triggered_by} key of alert context</li>
 *   <li>{@code healthScorePlaceholder} -- value reported for the {@code health_score} system metric</li>
 *   <li>{@code rateLimitWindowMinutes} -- window over which {@code max_alerts_per_hour} is counted</li>
 * </ul>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "alert-evaluation")
public class AlertEvaluationConfig {

    private boolean enabled = true;
    private int workerPoolSize = 10;
    private int queueCapacity = 100;
    private String triggeredBy = "evaluation_engine";
    private BigDecimal healthScorePlaceholder = BigDecimal.valueOf(85);
    private int rateLimitWindowMinutes = 60;
}
