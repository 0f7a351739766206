package com.muzee.auth.api.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 字符串按 UTF-8 编码后的字节数上限。
 * <p>
 * BCrypt 只取密码前 72 个字节，多字节字符按字符数校验会放过超长密码。`null` 视为合法，需配合 `@NotBlank` 使用。
 */
@Documented
@Constraint(validatedBy = MaxUtf8BytesValidator.class)
@Target({ElementType.FIELD, ElementType.PARAMETER, ElementType.RECORD_COMPONENT})
@Retention(RetentionPolicy.RUNTIME)
public @interface MaxUtf8Bytes {

    int value();

    String message() default "不能超过{value}个字节";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
