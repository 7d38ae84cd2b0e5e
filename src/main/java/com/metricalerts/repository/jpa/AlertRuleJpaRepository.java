package com.metricalerts.repository.jpa;

import com.metricalerts.entity.AlertRuleEntity;
import jakarta.persistence.QueryHint;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the alert_rules table.
 *
 * <p>The evaluation engine only reads rules: a single enabled rule by id, all enabled
 * rules of a team, or all enabled rules system-wide.
 */
@Repository
public interface AlertRuleJpaRepository extends JpaRepository<AlertRuleEntity, String> {

    Optional<AlertRuleEntity> findByIdAndEnabledTrue(String id);

    List<AlertRuleEntity> findByEnabledTrue();

    List<AlertRuleEntity> findByEnabledTrueAndTeamId(String teamId);

    /**
     * Trivial round-trip used by the system-health latency ping. Bounded by a query
     * timeout so a stalled store cannot block a rule evaluation indefinitely.
     */
    @QueryHints(@QueryHint(name = "jakarta.persistence.query.timeout", value = "5000"))
    @Query("SELECT COUNT(r) FROM AlertRuleEntity r")
    long pingRuleCount();
}
