package com.muzee.auth.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * 统一错误响应。
 * <p>
 * `error` 为机器可读的错误码，`details` 仅在参数校验失败时出现。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String error,
        String message,
        List<FieldErrorDetail> details
) {

    public static ErrorResponse of(String error, String message) {
        return new ErrorResponse(error, message, null);
    }

    public record FieldErrorDetail(String field, String message) {
    }
}
