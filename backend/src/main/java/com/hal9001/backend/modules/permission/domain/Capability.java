package com.hal9001.backend.modules.permission.domain;

public enum Capability {
    SELECT,
    INSERT,
    UPDATE,
    DELETE
}
