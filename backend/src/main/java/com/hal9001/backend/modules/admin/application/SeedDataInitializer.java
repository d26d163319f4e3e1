package com.hal9001.backend.modules.admin.application;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.hal9001.backend.modules.auth.application.ProvisionUserCommand;
import com.hal9001.backend.modules.auth.application.UserAccountService;
import com.hal9001.backend.modules.auth.infrastructure.persistence.UserRepository;
import com.hal9001.backend.modules.permission.application.PermissionService;
import com.hal9001.backend.modules.permission.domain.CapabilityFlags;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Populates the demo crew and their grants on startup when {@code hal.seed.enabled=true}
 * and the users table is empty. Existing data is never touched.
 */
@Component
@ConditionalOnProperty(prefix = "hal.seed", name = "enabled", havingValue = "true")
public class SeedDataInitializer implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(SeedDataInitializer.class);

    static final List<ProvisionSeed> USERS = List.of(
            new ProvisionSeed("usr_001", "Dave Bowman", "Data Editor", "d.bowman@discovery.co"),
            new ProvisionSeed("usr_002", "Frank Poole", "Data Viewer", "f.poole@discovery.co"),
            new ProvisionSeed("usr_003", "Admin User", "Tenant Admin", "admin@discovery.co"),
            new ProvisionSeed("usr_004", "System Architect", "System Admin", "sysarch@system.co")
    );

    private static final CapabilityFlags SELECT_ONLY = new CapabilityFlags(true, false, false, false);
    private static final CapabilityFlags EDITOR = new CapabilityFlags(true, true, true, false);

    private final UserRepository userRepository;
    private final UserAccountService userAccountService;
    private final PermissionService permissionService;
    private final String defaultPassword;

    public SeedDataInitializer(
            UserRepository userRepository,
            UserAccountService userAccountService,
            PermissionService permissionService,
            @Value("${hal.seed.default-password:hal9001-demo}") String defaultPassword
    ) {
        this.userRepository = userRepository;
        this.userAccountService = userAccountService;
        this.permissionService = permissionService;
        this.defaultPassword = defaultPassword;
    }

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        if (userRepository.count() > 0) {
            log.info("Users already present, skipping seed data");
            return;
        }

        for (ProvisionSeed seed : USERS) {
            userAccountService.provision(new ProvisionUserCommand(seed.id(), seed.name(), seed.role(), seed.email(), defaultPassword));
        }
        initialGrants().forEach(permissionService::replaceAll);
        log.info("Seeded {} users and initial grants", USERS.size());
    }

    static Map<String, Map<String, CapabilityFlags>> initialGrants() {
        Map<String, Map<String, CapabilityFlags>> grants = new LinkedHashMap<>();

        Map<String, CapabilityFlags> editor = new LinkedHashMap<>();
        editor.put("crew_vitals_log", EDITOR);
        editor.put("pod_bay_doors_status", EDITOR);
        editor.put("discovery_one_systems", SELECT_ONLY);
        grants.put("usr_001", editor);

        Map<String, CapabilityFlags> viewer = new LinkedHashMap<>();
        viewer.put("crew_vitals_log", SELECT_ONLY);
        viewer.put("discovery_one_systems", SELECT_ONLY);
        grants.put("usr_002", viewer);

        Map<String, CapabilityFlags> admin = new LinkedHashMap<>();
        admin.put("crew_vitals_log", CapabilityFlags.ALL);
        admin.put("pod_bay_doors_status", CapabilityFlags.ALL);
        admin.put("discovery_one_systems", CapabilityFlags.ALL);
        grants.put("usr_003", admin);

        return grants;
    }

    record ProvisionSeed(String id, String name, String role, String email) {
    }
}
