package com.hal9001.backend.modules.permission.presentation.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

public record UpdatePermissionsResponse(
        String status,
        String message,
        @JsonProperty("user_id") String userId,
        @JsonProperty("updated_tables") List<String> updatedTables
) {

    public static UpdatePermissionsResponse success(String userId, List<String> updatedTables) {
        return new UpdatePermissionsResponse("success", "Permissions updated for user " + userId, userId, updatedTables);
    }
}
