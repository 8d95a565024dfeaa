package com.sandwichtrader.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.sandwichtrader.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Error body of the sandwich API: {@code {success:false, error:{code, message, details, path,
 * timestamp}}}. {@code details} is left out when empty; a lifecycle conflict puts the
 * current state there.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ApiErrorResponse {

    private final boolean success;
    private final ErrorBody error;

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        Map<String, Object> shown = details == null || details.isEmpty() ? null : details;
        return new ApiErrorResponse(false, new ErrorBody(errorCode.getCode(), message, shown, path, Instant.now()));
    }

    @Getter
    @AllArgsConstructor(access = AccessLevel.PRIVATE)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorBody {
        private final String code;
        private final String message;
        private final Map<String, Object> details;
        private final String path;
        private final Instant timestamp;
    }
}
