package com.muzee.profile.api.dto;

public record UsernameAvailabilityResponse(boolean available) {
}
