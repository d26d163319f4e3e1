package com.hal9001.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * OAuth2 password-grant form. {@code username} carries the account email.
 */
public record TokenRequest(
        @NotBlank(message = "username is required") String username,
        @NotBlank(message = "password is required") String password
) {
}
