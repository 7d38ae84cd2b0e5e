package com.metricalerts.repository.jpa;

import com.metricalerts.entity.PerformanceMetricEntity;
import java.time.LocalDateTime;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the performance_metrics table.
 */
@Repository
public interface PerformanceMetricJpaRepository extends JpaRepository<PerformanceMetricEntity, Long> {

    Optional<PerformanceMetricEntity> findFirstByMetricNameAndCreatedAtGreaterThanEqualOrderByCreatedAtDesc(
            String metricName, LocalDateTime windowStart);
}
