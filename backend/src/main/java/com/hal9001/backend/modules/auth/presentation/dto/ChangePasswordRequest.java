package com.hal9001.backend.modules.auth.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ChangePasswordRequest(
        @JsonProperty("current_password")
        @NotBlank(message = "current_password is required") String currentPassword,
        @JsonProperty("new_password")
        @NotBlank(message = "new_password is required")
        @Size(min = 8, max = 72, message = "new_password must be 8-72 characters") String newPassword
) {
}
