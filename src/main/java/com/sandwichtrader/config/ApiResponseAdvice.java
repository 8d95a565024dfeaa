package com.sandwichtrader.config;

import com.sandwichtrader.api.controller.SandwichController;
import com.sandwichtrader.api.dto.response.ApiErrorResponse;
import com.sandwichtrader.api.dto.response.ApiResponse;
import org.springframework.core.MethodParameter;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;

/**
 * Wraps {@link SandwichController} results in {@link ApiResponse}. Error bodies from
 * GlobalExceptionHandler pass through unchanged.
 */
@RestControllerAdvice(assignableTypes = SandwichController.class)
public class ApiResponseAdvice implements ResponseBodyAdvice<Object> {

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
        return body instanceof ApiErrorResponse ? body : ApiResponse.of(body);
    }
}
