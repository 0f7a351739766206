package com.muzee.auth.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 业务错误码。
 * <p>
 * 每个错误码携带对外暴露的 `error` 字符串、HTTP 状态与默认提示语。
 */
@Getter
public enum ErrorCode {
    INVALID_REQUEST("invalid_request", HttpStatus.BAD_REQUEST, "请求格式不正确"),
    VALIDATION_ERROR("validation_error", HttpStatus.BAD_REQUEST, "输入内容有误"),
    EMAIL_ALREADY_EXISTS("email_already_exists", HttpStatus.BAD_REQUEST, "该邮箱已被注册"),
    RATE_LIMIT_EXCEEDED("rate_limit_exceeded", HttpStatus.TOO_MANY_REQUESTS, "请求过于频繁，请稍后再试"),
    SESSION_NOT_FOUND("session_not_found", HttpStatus.BAD_REQUEST, "验证码无效或已过期，请重新开始注册"),
    INVALID_CODE("invalid_code", HttpStatus.BAD_REQUEST, "验证码错误"),
    INVALID_CREDENTIALS("invalid_credentials", HttpStatus.UNAUTHORIZED, "邮箱或密码错误"),
    REFRESH_TOKEN_INVALID("refresh_token_invalid", HttpStatus.UNAUTHORIZED, "刷新令牌无效或已过期"),
    CLIENT_ID_MISMATCH("client_id_mismatch", HttpStatus.UNAUTHORIZED, "客户端不匹配，请重新登录"),
    MISSING_REFRESH_TOKEN("missing_refresh_token", HttpStatus.BAD_REQUEST, "缺少刷新令牌"),
    TOKEN_NOT_FOUND("token_not_found", HttpStatus.BAD_REQUEST, "会话不存在，可能已登出"),
    UNAUTHORIZED("unauthorized", HttpStatus.UNAUTHORIZED, "需要登录"),
    INVALID_TOKEN("invalid_token", HttpStatus.UNAUTHORIZED, "访问令牌无效或已过期"),
    USER_NOT_FOUND("user_not_found", HttpStatus.UNAUTHORIZED, "用户不存在"),
    PROFILE_NOT_FOUND("profile_not_found", HttpStatus.NOT_FOUND, "尚未创建个人资料"),
    PROFILE_ALREADY_EXISTS("profile_already_exists", HttpStatus.CONFLICT, "个人资料已存在"),
    USERNAME_TAKEN("username_taken", HttpStatus.CONFLICT, "用户名已被使用"),
    NOT_FOUND("not_found", HttpStatus.NOT_FOUND, "接口不存在"),
    METHOD_NOT_ALLOWED("method_not_allowed", HttpStatus.METHOD_NOT_ALLOWED, "不支持该请求方法"),
    UNSUPPORTED_MEDIA_TYPE("unsupported_media_type", HttpStatus.UNSUPPORTED_MEDIA_TYPE, "不支持该请求内容类型"),
    INTERNAL_ERROR("internal_server_error", HttpStatus.INTERNAL_SERVER_ERROR, "服务异常，请稍后重试");

    private final String code;
    private final HttpStatus status;
    private final String defaultMessage;

    ErrorCode(String code, HttpStatus status, String defaultMessage) {
        this.code = code;
        this.status = status;
        this.defaultMessage = defaultMessage;
    }
}
