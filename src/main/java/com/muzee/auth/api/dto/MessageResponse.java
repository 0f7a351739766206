package com.muzee.auth.api.dto;

public record MessageResponse(String message) {
}
