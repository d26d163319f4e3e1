package com.hal9001.backend.modules.permission.presentation.dto;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record UpdatePermissionsRequest(
        @JsonProperty("user_id")
        @NotBlank(message = "user_id is required") String userId,
        @NotNull(message = "permissions is required")
        Map<String, @NotNull @Valid GrantFlags> permissions
) {
}
