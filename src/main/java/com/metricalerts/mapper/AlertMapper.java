package com.metricalerts.mapper;

import com.metricalerts.domain.model.Alert;
import com.metricalerts.entity.AlertEntity;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between the {@link Alert} domain model and {@link AlertEntity}.
 *
 * <p>The context field is a Map in the domain model but stored as a JSON string in
 * the entity. This mapper handles the JSON conversion via {@link JsonHelper}.
 */
@Mapper
public interface AlertMapper {

    @Mapping(source = "context", target = "context", qualifiedByName = "contextToJson")
    AlertEntity toEntity(Alert alert);

    @Mapping(source = "context", target = "context", qualifiedByName = "jsonToContext")
    Alert toDomain(AlertEntity entity);

    List<Alert> toDomainList(List<AlertEntity> entities);

    @Named("contextToJson")
    default String contextToJson(Map<String, Object> context) {
        return JsonHelper.toJson(context);
    }

    @Named("jsonToContext")
    default Map<String, Object> jsonToContext(String json) {
        return JsonHelper.toMap(json);
    }
}
