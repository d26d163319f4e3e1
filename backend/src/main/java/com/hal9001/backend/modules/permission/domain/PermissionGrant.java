package com.hal9001.backend.modules.permission.domain;

import jakarta.persistence.Column;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;

import org.springframework.data.domain.Persistable;

/**
 * One row of the permission matrix. A missing row means no capability at all.
 */
@Entity
@Table(name = "permission_grants")
public class PermissionGrant implements Persistable<PermissionGrantId> {

    @EmbeddedId
    private PermissionGrantId id;

    @Column(name = "can_select", nullable = false)
    private boolean canSelect;

    @Column(name = "can_insert", nullable = false)
    private boolean canInsert;

    @Column(name = "can_update", nullable = false)
    private boolean canUpdate;

    @Column(name = "can_delete", nullable = false)
    private boolean canDelete;

    // grants are only ever inserted after a bulk delete, so skip the merge lookup
    @Transient
    private boolean newEntity = true;

    protected PermissionGrant() {
    }

    public PermissionGrant(String userId, String resourceName, CapabilityFlags flags) {
        this.id = new PermissionGrantId(userId, resourceName);
        this.canSelect = flags.select();
        this.canInsert = flags.insert();
        this.canUpdate = flags.update();
        this.canDelete = flags.delete();
    }

    @Override
    public PermissionGrantId getId() {
        return id;
    }

    public String getResourceName() {
        return id.getResourceName();
    }

    public CapabilityFlags toFlags() {
        return new CapabilityFlags(canSelect, canInsert, canUpdate, canDelete);
    }

    @Override
    public boolean isNew() {
        return newEntity;
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.newEntity = false;
    }
}
