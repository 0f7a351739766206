package com.muzee.auth.api;

import com.muzee.auth.api.dto.ErrorResponse;
import com.muzee.auth.exception.BusinessException;
import com.muzee.auth.exception.ErrorCode;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.List;
import java.util.Locale;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 业务异常按错误码自带的 HTTP 状态返回。
     *
     * @param ex 业务异常，包含错误码与消息。
     * @return 响应体：error/message。
     */
    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusiness(BusinessException ex) {
        ErrorCode errorCode = ex.getErrorCode();
        return ResponseEntity.status(errorCode.getStatus())
                .body(ErrorResponse.of(errorCode.getCode(), ex.getMessage()));
    }

    /**
     * 请求体校验失败（@Valid）统一返回：HTTP 400。
     * 每个字段错误都放入 details，字段名与请求体保持一致（snake_case）。
     *
     * @param ex Spring 的方法参数校验异常。
     * @return 响应体：error/message/details。
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        List<ErrorResponse.FieldErrorDetail> details = ex.getBindingResult().getFieldErrors().stream()
                .map(this::toDetail)
                .toList();
        return validationError(details);
    }

    /**
     * 约束校验失败（如 @Validated 方法参数）统一返回：HTTP 400。
     *
     * @param ex 参数约束异常。
     * @return 响应体：error/message/details。
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(ConstraintViolationException ex) {
        List<ErrorResponse.FieldErrorDetail> details = ex.getConstraintViolations().stream()
                .map(this::toDetail)
                .toList();
        return validationError(details);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ErrorResponse> handleMethodValidation(HandlerMethodValidationException ex) {
        List<ErrorResponse.FieldErrorDetail> details = ex.getAllValidationResults().stream()
                .flatMap(result -> result.getResolvableErrors().stream()
                        .map(error -> new ErrorResponse.FieldErrorDetail(
                                snakeCase(String.valueOf(result.getMethodParameter().getParameterName())),
                                error.getDefaultMessage())))
                .toList();
        return validationError(details);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException ex) {
        return validationError(List.of(new ErrorResponse.FieldErrorDetail(ex.getParameterName(), "必填项")));
    }

    /**
     * 请求体无法解析（非法 JSON、类型不符）统一返回：HTTP 400。
     *
     * @param ex 消息读取异常。
     * @return 响应体：error/message。
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of(ErrorCode.INVALID_REQUEST.getCode(), ErrorCode.INVALID_REQUEST.getDefaultMessage()));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResource(NoResourceFoundException ex) {
        return errorCode(ErrorCode.NOT_FOUND);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        return errorCode(ErrorCode.METHOD_NOT_ALLOWED);
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMediaTypeNotSupported(HttpMediaTypeNotSupportedException ex) {
        return errorCode(ErrorCode.UNSUPPORTED_MEDIA_TYPE);
    }

    /**
     * 未处理异常统一返回：HTTP 500。
     * 记录错误日志并返回通用提示，不暴露内部细节。
     * Spring MVC 自带 4xx 状态的异常（如不可接受的响应类型）保留原状态码，按 `invalid_request` 返回。
     *
     * @param ex 未捕获的异常。
     * @return 响应体：error/message。
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
        if (ex instanceof org.springframework.web.ErrorResponse errorResponse
                && errorResponse.getStatusCode().is4xxClientError()) {
            HttpStatusCode status = errorResponse.getStatusCode();
            log.debug("Client error status={}: {}", status.value(), ex.getMessage());
            return ResponseEntity.status(status)
                    .body(ErrorResponse.of(ErrorCode.INVALID_REQUEST.getCode(), ErrorCode.INVALID_REQUEST.getDefaultMessage()));
        }
        log.error("Unhandled exception", ex);
        return errorCode(ErrorCode.INTERNAL_ERROR);
    }

    private ResponseEntity<ErrorResponse> errorCode(ErrorCode errorCode) {
        return ResponseEntity.status(errorCode.getStatus())
                .body(ErrorResponse.of(errorCode.getCode(), errorCode.getDefaultMessage()));
    }

    private ResponseEntity<ErrorResponse> validationError(List<ErrorResponse.FieldErrorDetail> details) {
        ErrorCode errorCode = ErrorCode.VALIDATION_ERROR;
        return ResponseEntity.status(errorCode.getStatus())
                .body(new ErrorResponse(errorCode.getCode(), errorCode.getDefaultMessage(), details));
    }

    private ErrorResponse.FieldErrorDetail toDetail(FieldError error) {
        return new ErrorResponse.FieldErrorDetail(snakeCase(error.getField()), error.getDefaultMessage());
    }

    private ErrorResponse.FieldErrorDetail toDetail(ConstraintViolation<?> violation) {
        String path = violation.getPropertyPath().toString();
        String field = path.substring(path.lastIndexOf('.') + 1);
        return new ErrorResponse.FieldErrorDetail(snakeCase(field), violation.getMessage());
    }

    static String snakeCase(String field) {
        return field.replaceAll("([a-z0-9])([A-Z])", "$1_$2").toLowerCase(Locale.ROOT);
    }
}
