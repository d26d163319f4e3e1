package com.hal9001.backend.global.security;

public record JwtAuthenticationPrincipal(String userId) {
}
