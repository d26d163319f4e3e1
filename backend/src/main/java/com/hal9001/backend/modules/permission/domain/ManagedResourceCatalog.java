package com.hal9001.backend.modules.permission.domain;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Resource names the permission matrix may reference, in configured order.
 */
@Component
public class ManagedResourceCatalog {

    static final String DEFAULT_RESOURCES =
            "crew_vitals_log,pod_bay_doors_status,discovery_one_systems,monolith_observations_secure,mission_critical_data";

    private final Set<String> resources;

    public ManagedResourceCatalog(@Value("${hal.permissions.resources:" + DEFAULT_RESOURCES + "}") String resources) {
        LinkedHashSet<String> names = new LinkedHashSet<>();
        Arrays.stream(resources.split(","))
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .forEach(names::add);
        if (names.isEmpty()) {
            throw new IllegalStateException("hal.permissions.resources must name at least one resource");
        }
        this.resources = Collections.unmodifiableSet(names);
    }

    public boolean contains(String resourceName) {
        return resourceName != null && resources.contains(resourceName);
    }

    public List<String> list() {
        return List.copyOf(resources);
    }
}
