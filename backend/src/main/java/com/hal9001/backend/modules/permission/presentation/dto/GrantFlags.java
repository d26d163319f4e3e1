package com.hal9001.backend.modules.permission.presentation.dto;

import com.hal9001.backend.modules.permission.domain.CapabilityFlags;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire form of {@link CapabilityFlags}. An omitted flag reads as false.
 */
public record GrantFlags(
        @JsonProperty("can_select") Boolean canSelect,
        @JsonProperty("can_insert") Boolean canInsert,
        @JsonProperty("can_update") Boolean canUpdate,
        @JsonProperty("can_delete") Boolean canDelete
) {

    public static GrantFlags from(CapabilityFlags flags) {
        return new GrantFlags(flags.select(), flags.insert(), flags.update(), flags.delete());
    }

    public CapabilityFlags toFlags() {
        return new CapabilityFlags(
                Boolean.TRUE.equals(canSelect),
                Boolean.TRUE.equals(canInsert),
                Boolean.TRUE.equals(canUpdate),
                Boolean.TRUE.equals(canDelete)
        );
    }
}
