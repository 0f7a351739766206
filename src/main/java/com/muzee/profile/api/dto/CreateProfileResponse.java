package com.muzee.profile.api.dto;

public record CreateProfileResponse(
        String message,
        ProfileResponse userProfile
) {
}
