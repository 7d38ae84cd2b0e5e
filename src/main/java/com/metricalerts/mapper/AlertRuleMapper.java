package com.metricalerts.mapper;

import com.metricalerts.domain.model.AlertRule;
import com.metricalerts.entity.AlertRuleEntity;
import java.util.List;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper between the {@link AlertRule} domain model and {@link AlertRuleEntity}.
 *
 * <p>Field names are identical across both layers, so no explicit {@code @Mapping}
 * annotations are needed.
 */
@Mapper
public interface AlertRuleMapper {

    AlertRule toDomain(AlertRuleEntity entity);

    List<AlertRule> toDomainList(List<AlertRuleEntity> entities);
}
