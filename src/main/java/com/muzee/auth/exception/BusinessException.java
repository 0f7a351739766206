package com.muzee.auth.exception;

import lombok.Getter;

/**
 * 业务异常。
 * <p>
 * 由服务层抛出，经 {@code GlobalExceptionHandler} 统一映射为对应的 HTTP 状态与响应体。
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
