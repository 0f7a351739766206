package com.muzee.auth.util;

import java.util.Locale;

public final class EmailNormalizer {

    private EmailNormalizer() {
    }

    /**
     * 标准化邮箱：去除首尾空白并转小写。所有查询、建号与存储键都使用标准化结果。
     *
     * @param email 原始邮箱文本。
     * @return 标准化后的邮箱；入参为 null 时返回 null。
     */
    public static String normalize(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }
}
