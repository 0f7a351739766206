package com.muzee.profile.api.dto;

import java.time.Instant;

public record ProfileResponse(
        Long id,
        Long userId,
        String name,
        String username,
        String iconPath,
        Instant createdAt,
        Instant updatedAt
) {
}
