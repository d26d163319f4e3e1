package com.hal9001.backend.modules.permission;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import com.hal9001.backend.modules.permission.application.PermissionService;
import com.hal9001.backend.modules.permission.domain.CapabilityFlags;
import com.hal9001.backend.support.TestUserFactory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = {
        "hal.storage.embedded-url=jdbc:h2:mem:grants_atomic_it;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1",
        "hal.permissions.resources=crew_vitals_log,pod_bay_doors_status,discovery_one_systems,"
                + PermissionReplaceAtomicityIntegrationTest.OVERSIZED_RESOURCE
})
class PermissionReplaceAtomicityIntegrationTest {

    // accepted by the catalog but longer than the resource_name column
    static final String OVERSIZED_RESOURCE =
            "x_oversized_resource_name_0123456789012345678901234567890123456789012345678901234567890123456789012345678901234567890123456789_overflow";

    private static final CapabilityFlags SELECT_ONLY = new CapabilityFlags(true, false, false, false);

    private static final Map<String, CapabilityFlags> SET_A = Map.of(
            "crew_vitals_log", SELECT_ONLY,
            "pod_bay_doors_status", SELECT_ONLY);
    private static final Map<String, CapabilityFlags> SET_B = Map.of(
            "discovery_one_systems", CapabilityFlags.ALL);

    @Autowired
    PermissionService permissionService;

    @Autowired
    TestUserFactory testUserFactory;

    @BeforeEach
    void setUp() {
        testUserFactory.deleteAll();
        testUserFactory.ensureDaveBowman();
    }

    @Test
    void concurrentReaderSeesOldOrNewSetNeverAMix() throws Exception {
        permissionService.replaceAll("usr_001", SET_A);
        AtomicBoolean writing = new AtomicBoolean(true);
        List<Set<String>> mixed = Collections.synchronizedList(new ArrayList<>());
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<?> writer = executor.submit(() -> {
                try {
                    for (int i = 0; i < 200; i++) {
                        permissionService.replaceAll("usr_001", i % 2 == 0 ? SET_B : SET_A);
                    }
                } finally {
                    writing.set(false);
                }
            });
            Future<?> reader = executor.submit(() -> {
                while (writing.get()) {
                    Map<String, CapabilityFlags> seen = permissionService.getGrants("usr_001");
                    if (!seen.equals(SET_A) && !seen.equals(SET_B)) {
                        mixed.add(seen.keySet());
                    }
                }
            });

            writer.get(60, TimeUnit.SECONDS);
            reader.get(60, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        assertThat(mixed).isEmpty();
        assertThat(permissionService.getGrants("usr_001")).isEqualTo(SET_A);
    }

    @Test
    void failedInsertLeavesPreviousGrantsInPlace() {
        permissionService.replaceAll("usr_001", SET_A);

        Map<String, CapabilityFlags> failing = new LinkedHashMap<>();
        failing.put("discovery_one_systems", CapabilityFlags.ALL);
        failing.put(OVERSIZED_RESOURCE, SELECT_ONLY);

        assertThatThrownBy(() -> permissionService.replaceAll("usr_001", failing))
                .isInstanceOf(RuntimeException.class);

        assertThat(permissionService.getGrants("usr_001")).isEqualTo(SET_A);
    }
}
