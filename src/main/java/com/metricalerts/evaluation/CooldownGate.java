package com.metricalerts.evaluation;

import com.metricalerts.domain.model.AlertRule;
import com.metricalerts.repository.jpa.AlertJpaRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Suppresses re-alerting on a rule while its most recent alert is younger than the
 * rule's cooldown. The status of that alert does not matter: a resolved alert still
 * holds the cooldown until it ages out.
 *
 * <p>A rule with no cooldown (null or zero) is never suppressed. Store errors propagate
 * and fail the rule's evaluation.
 */
@Component
public class CooldownGate {

    private static final Logger log = LoggerFactory.getLogger(CooldownGate.class);

    private final AlertJpaRepository alertJpaRepository;
    private final Clock clock;

    public CooldownGate(AlertJpaRepository alertJpaRepository, Clock clock) {
        this.alertJpaRepository = alertJpaRepository;
        this.clock = clock;
    }

    public boolean isInCooldown(AlertRule alertRule) {
        Integer cooldownMinutes = alertRule.getCooldownMinutes();
        if (cooldownMinutes == null || cooldownMinutes <= 0) {
            return false;
        }

        LocalDateTime boundary = LocalDateTime.now(clock).minusMinutes(cooldownMinutes);
        boolean inCooldown = alertJpaRepository
                .findFirstByAlertRuleIdAndCreatedAtGreaterThanEqualOrderByCreatedAtDesc(alertRule.getId(), boundary)
                .isPresent();
        if (inCooldown) {
            log.debug("Rule {} in cooldown ({} min)", alertRule.getId(), cooldownMinutes);
        }
        return inCooldown;
    }
}
