package com.metricalerts.api.controller;

import com.metricalerts.api.dto.response.AlertResponse;
import com.metricalerts.mapper.AlertDtoMapper;
import com.metricalerts.mapper.AlertMapper;
import com.metricalerts.repository.jpa.AlertJpaRepository;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only view of alerts produced by evaluation runs.
 */
@RestController
@RequestMapping("/api/alerts")
public class AlertController {

    private final AlertJpaRepository alertJpaRepository;
    private final AlertMapper alertMapper = Mappers.getMapper(AlertMapper.class);
    private final AlertDtoMapper alertDtoMapper = Mappers.getMapper(AlertDtoMapper.class);

    public AlertController(AlertJpaRepository alertJpaRepository) {
        this.alertJpaRepository = alertJpaRepository;
    }

    /** Alerts raised for a rule, newest first. */
    @GetMapping("/rules/{ruleId}")
    public ResponseEntity<List<AlertResponse>> getAlertsForRule(@PathVariable String ruleId) {
        return ResponseEntity.ok(alertDtoMapper.toResponseList(
                alertMapper.toDomainList(alertJpaRepository.findByAlertRuleIdOrderByCreatedAtDesc(ruleId))));
    }
}
