package com.hal9001.backend.modules.auth.presentation.dto;

import com.hal9001.backend.modules.auth.domain.User;

public record UserProfileResponse(
        String id,
        String name,
        String role,
        String email
) {

    public static UserProfileResponse from(User user) {
        return new UserProfileResponse(user.getId(), user.getName(), user.getRole(), user.getEmail());
    }
}
