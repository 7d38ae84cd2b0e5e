package com.metricalerts.config;

import com.metricalerts.api.dto.response.ApiErrorResponse;
import com.metricalerts.api.dto.response.ApiResponse;
import com.metricalerts.api.dto.response.EvaluationResponse;
import java.time.Clock;
import org.springframework.core.MethodParameter;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;

/**
 * Wraps controller return values in {@link ApiResponse}.
 *
 * <p>Evaluation responses carry their own {@code success} flag and summary, so they are
 * written as-is along with error bodies and actuator output.
 */
@RestControllerAdvice
public class ApiResponseAdvice implements ResponseBodyAdvice<Object> {

    private final Clock clock;

    public ApiResponseAdvice(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean supports(MethodParameter returnType, Class<? extends HttpMessageConverter<?>> converterType) {
        return true;
    }

    @Override
    public Object beforeBodyWrite(
            Object body,
            MethodParameter returnType,
            MediaType selectedContentType,
            Class<? extends HttpMessageConverter<?>> selectedConverterType,
            ServerHttpRequest request,
            ServerHttpResponse response) {

        String path = request.getURI().getPath();
        if (path.startsWith("/actuator") || path.equals("/error")) {
            return body;
        }

        if (body instanceof ApiResponse<?>
                || body instanceof ApiErrorResponse
                || body instanceof EvaluationResponse) {
            return body;
        }

        if (StringHttpMessageConverter.class.isAssignableFrom(selectedConverterType)) {
            return body;
        }

        return ApiResponse.of(body, clock);
    }
}
