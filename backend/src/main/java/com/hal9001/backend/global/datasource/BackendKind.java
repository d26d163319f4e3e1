package com.hal9001.backend.global.datasource;

/**
 * Storage engines the access core can run on.
 */
public enum BackendKind {

    /** Networked relational service (PostgreSQL). */
    PRIMARY,

    /** In-process engine (H2), also the fallback target. */
    EMBEDDED
}
