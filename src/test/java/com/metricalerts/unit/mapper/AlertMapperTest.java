package com.metricalerts.unit.mapper;

import static org.assertj.core.api.Assertions.assertThat;

import com.metricalerts.domain.enums.AlertSeverity;
import com.metricalerts.domain.enums.AlertStatus;
import com.metricalerts.domain.model.Alert;
import com.metricalerts.domain.model.AlertRule;
import com.metricalerts.entity.AlertEntity;
import com.metricalerts.entity.AlertRuleEntity;
import com.metricalerts.mapper.AlertMapper;
import com.metricalerts.mapper.AlertRuleMapper;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;

class AlertMapperTest {

    private final AlertMapper alertMapper = Mappers.getMapper(AlertMapper.class);
    private final AlertRuleMapper alertRuleMapper = Mappers.getMapper(AlertRuleMapper.class);

    @Test
    @DisplayName("Alert context map is stored as JSON text and read back")
    void contextStoredAsJson() {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("rule_name", "High error rate");
        context.put("evaluation_window_minutes", 15);

        AlertEntity entity = alertMapper.toEntity(Alert.builder()
                .id("a1")
                .severity(AlertSeverity.LOW)
                .status(AlertStatus.ACTIVE)
                .context(context)
                .build());

        assertThat(entity.getContext()).contains("\"rule_name\":\"High error rate\"");
        assertThat(alertMapper.toDomain(entity).getContext()).isEqualTo(context);
    }

    @Test
    @DisplayName("Missing context maps to null both ways")
    void nullContext() {
        assertThat(alertMapper.toEntity(Alert.builder().id("a1").build()).getContext()).isNull();
        assertThat(alertMapper.toDomain(AlertEntity.builder().id("a1").context(" ").build()).getContext())
                .isNull();
    }

    @Test
    @DisplayName("Rule entity maps to the domain rule with nullable rate limit kept")
    void ruleToDomain() {
        AlertRule rule = alertRuleMapper.toDomain(AlertRuleEntity.builder()
                .id("r1")
                .name("Latency")
                .metricSource("performance_metrics")
                .thresholdValue(new BigDecimal("500"))
                .thresholdOperator(">=")
                .cooldownMinutes(0)
                .build());

        assertThat(rule.getId()).isEqualTo("r1");
        assertThat(rule.isEnabled()).isTrue();
        assertThat(rule.getCooldownMinutes()).isZero();
        assertThat(rule.getMaxAlertsPerHour()).isNull();
        assertThat(rule.getEvaluationWindowMinutes()).isEqualTo(5);
    }
}
