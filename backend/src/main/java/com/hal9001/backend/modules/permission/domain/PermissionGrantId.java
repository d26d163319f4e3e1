package com.hal9001.backend.modules.permission.domain;

import java.io.Serializable;
import java.util.Objects;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

@Embeddable
public class PermissionGrantId implements Serializable {

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(name = "resource_name", nullable = false, length = 128)
    private String resourceName;

    protected PermissionGrantId() {
    }

    public PermissionGrantId(String userId, String resourceName) {
        this.userId = userId;
        this.resourceName = resourceName;
    }

    public String getUserId() {
        return userId;
    }

    public String getResourceName() {
        return resourceName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PermissionGrantId that)) return false;
        return Objects.equals(userId, that.userId) && Objects.equals(resourceName, that.resourceName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, resourceName);
    }
}
