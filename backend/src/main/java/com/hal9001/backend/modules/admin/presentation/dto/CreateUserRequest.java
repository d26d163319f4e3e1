package com.hal9001.backend.modules.admin.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record CreateUserRequest(
        @Size(max = 64, message = "id must be at most 64 characters")
        @Pattern(regexp = "^[A-Za-z0-9_\\-]*$", message = "id may only contain letters, digits, '_' and '-'") String id,
        @NotBlank(message = "name is required") @Size(max = 255) String name,
        @NotBlank(message = "role is required") @Size(max = 100) String role,
        @NotBlank(message = "email is required") @Email(message = "email must be valid") @Size(max = 320) String email,
        @NotBlank(message = "password is required")
        @Size(min = 8, max = 72, message = "password must be 8-72 characters") String password
) {
}
