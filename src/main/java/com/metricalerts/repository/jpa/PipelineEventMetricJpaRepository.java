package com.metricalerts.repository.jpa;

import com.metricalerts.domain.enums.PipelineEventStatus;
import com.metricalerts.entity.PipelineEventMetricEntity;
import java.time.LocalDateTime;
import java.util.Collection;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the pipeline_event_metrics table.
 *
 * <p>Aggregations are pushed down to the store as counts and averages. Each query has
 * a team-scoped and an unscoped variant; the unscoped one serves global rules.
 */
@Repository
public interface PipelineEventMetricJpaRepository extends JpaRepository<PipelineEventMetricEntity, Long> {

    /**
     * Total and status-matching event counts for a window, read by one statement so that
     * {@code matching <= total} always holds.
     */
    interface StatusCounts {

        Long getTotal();

        /** Null when the window holds no events. */
        Long getMatching();
    }

    @Query("SELECT COUNT(e) AS total, "
            + "SUM(CASE WHEN e.status IN :statuses THEN 1 ELSE 0 END) AS matching "
            + "FROM PipelineEventMetricEntity e WHERE e.createdAt >= :windowStart")
    StatusCounts countStatusesSince(
            @Param("statuses") Collection<PipelineEventStatus> statuses,
            @Param("windowStart") LocalDateTime windowStart);

    @Query("SELECT COUNT(e) AS total, "
            + "SUM(CASE WHEN e.status IN :statuses THEN 1 ELSE 0 END) AS matching "
            + "FROM PipelineEventMetricEntity e WHERE e.teamId = :teamId AND e.createdAt >= :windowStart")
    StatusCounts countStatusesForTeamSince(
            @Param("teamId") String teamId,
            @Param("statuses") Collection<PipelineEventStatus> statuses,
            @Param("windowStart") LocalDateTime windowStart);

    @Query("SELECT AVG(e.totalDurationMs) FROM PipelineEventMetricEntity e "
            + "WHERE e.createdAt >= :windowStart AND e.totalDurationMs IS NOT NULL")
    Double averageDurationSince(@Param("windowStart") LocalDateTime windowStart);

    @Query("SELECT AVG(e.totalDurationMs) FROM PipelineEventMetricEntity e "
            + "WHERE e.teamId = :teamId AND e.createdAt >= :windowStart AND e.totalDurationMs IS NOT NULL")
    Double averageDurationForTeamSince(
            @Param("teamId") String teamId, @Param("windowStart") LocalDateTime windowStart);
}
