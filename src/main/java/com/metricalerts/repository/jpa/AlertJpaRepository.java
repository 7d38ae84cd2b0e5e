package com.metricalerts.repository.jpa;

import com.metricalerts.domain.enums.AlertStatus;
import com.metricalerts.entity.AlertEntity;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the alerts table.
 *
 * <p>Read paths serve the cooldown gate (most recent alert since a boundary), the
 * dedup check (unresolved alerts per rule) and the hourly rate limit. The only write
 * path is the insert performed by the AlertTrigger.
 */
@Repository
public interface AlertJpaRepository extends JpaRepository<AlertEntity, String> {

    Optional<AlertEntity> findFirstByAlertRuleIdAndCreatedAtGreaterThanEqualOrderByCreatedAtDesc(
            String alertRuleId, LocalDateTime boundary);

    List<AlertEntity> findByAlertRuleIdAndStatusIn(String alertRuleId, Collection<AlertStatus> statuses);

    long countByAlertRuleIdAndCreatedAtGreaterThanEqual(String alertRuleId, LocalDateTime since);

    List<AlertEntity> findByAlertRuleIdOrderByCreatedAtDesc(String alertRuleId);
}
