package com.hal9001.backend.modules.auth.application;

/**
 * Input for creating a user account. {@code id} may be null, in which case one is generated.
 */
public record ProvisionUserCommand(
        String id,
        String name,
        String role,
        String email,
        String password
) {
}
