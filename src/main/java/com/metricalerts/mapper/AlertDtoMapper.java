package com.metricalerts.mapper;

import com.metricalerts.api.dto.response.AlertResponse;
import com.metricalerts.domain.model.Alert;
import java.util.List;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper from alert domain models to REST response DTOs.
 */
@Mapper
public interface AlertDtoMapper {

    AlertResponse toResponse(Alert alert);

    List<AlertResponse> toResponseList(List<Alert> alerts);
}
