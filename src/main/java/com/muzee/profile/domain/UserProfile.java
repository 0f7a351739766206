package com.muzee.profile.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 用户个人资料实体，与用户一对一。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserProfile {
    private Long id;
    private Long userId;
    private String name;
    private String username;
    private String iconPath;
    private Instant createdAt;
    private Instant updatedAt;
}
