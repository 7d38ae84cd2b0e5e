package com.metricalerts.repository.jpa;

import com.metricalerts.entity.AlertHistoryEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the alert_history audit table.
 */
@Repository
public interface AlertHistoryJpaRepository extends JpaRepository<AlertHistoryEntity, Long> {}
