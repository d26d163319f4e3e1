package com.hal9001.backend.modules.permission.domain;

/**
 * The four capability bits a user holds on one resource.
 */
public record CapabilityFlags(boolean select, boolean insert, boolean update, boolean delete) {

    public static final CapabilityFlags NONE = new CapabilityFlags(false, false, false, false);
    public static final CapabilityFlags ALL = new CapabilityFlags(true, true, true, true);

    public boolean allows(Capability capability) {
        return switch (capability) {
            case SELECT -> select;
            case INSERT -> insert;
            case UPDATE -> update;
            case DELETE -> delete;
        };
    }
}
