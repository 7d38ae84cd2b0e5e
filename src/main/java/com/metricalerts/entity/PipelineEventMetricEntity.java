package com.metricalerts.entity;

import com.metricalerts.domain.enums.PipelineEventStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the pipeline_event_metrics table.
 *
 * <p>One row per processed pipeline event, written by the processing pipeline.
 * The evaluation engine only reads it, aggregating rows inside a rule's window.
 */
@Entity
@Table(
        name = "pipeline_event_metrics",
        indexes = {@Index(name = "idx_pipeline_events_team_created", columnList = "team_id, created_at")})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PipelineEventMetricEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "team_id", length = 36)
    private String teamId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, columnDefinition = "varchar(20)")
    private PipelineEventStatus status;

    @Column(name = "total_duration_ms")
    private Integer totalDurationMs;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
