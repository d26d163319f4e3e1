package com.hal9001.backend.modules.permission.application;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.hal9001.backend.global.error.ProblemException;
import com.hal9001.backend.modules.auth.infrastructure.persistence.UserRepository;
import com.hal9001.backend.modules.permission.domain.Capability;
import com.hal9001.backend.modules.permission.domain.CapabilityFlags;
import com.hal9001.backend.modules.permission.domain.ManagedResourceCatalog;
import com.hal9001.backend.modules.permission.domain.PermissionGrant;
import com.hal9001.backend.modules.permission.infrastructure.persistence.PermissionGrantRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Per-user, per-resource capability matrix.
 *
 * <p>{@link #replaceAll} swaps a user's whole grant set in one transaction: the user row is
 * locked, every existing grant is deleted and the new set inserted. Readers see either the
 * old set or the new one. Two replacements for the same user serialize on the row lock and
 * the last to commit wins.
 */
@Service
public class PermissionService {

    private static final Logger log = LoggerFactory.getLogger(PermissionService.class);

    static final String VALIDATION_ERROR = "validation_error";

    private final PermissionGrantRepository permissionGrantRepository;
    private final UserRepository userRepository;
    private final ManagedResourceCatalog resourceCatalog;

    public PermissionService(
            PermissionGrantRepository permissionGrantRepository,
            UserRepository userRepository,
            ManagedResourceCatalog resourceCatalog
    ) {
        this.permissionGrantRepository = permissionGrantRepository;
        this.userRepository = userRepository;
        this.resourceCatalog = resourceCatalog;
    }

    /**
     * @return the user's grants keyed by resource name in ascending order; empty for an unknown user
     */
    @Transactional(readOnly = true)
    public Map<String, CapabilityFlags> getGrants(String userId) {
        Map<String, CapabilityFlags> grants = new LinkedHashMap<>();
        for (PermissionGrant grant : permissionGrantRepository.findByIdUserIdOrderByIdResourceNameAsc(userId)) {
            grants.put(grant.getResourceName(), grant.toFlags());
        }
        return grants;
    }

    /**
     * Replaces every grant of {@code userId} with {@code grants}. An empty map revokes everything.
     *
     * @return the resource names written, sorted
     */
    @Transactional
    public List<String> replaceAll(String userId, Map<String, CapabilityFlags> grants) {
        if (userId == null || userId.isBlank()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, VALIDATION_ERROR, "user_id is required");
        }
        if (grants == null) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, VALIDATION_ERROR, "permissions are required");
        }

        Map<String, CapabilityFlags> sorted = new TreeMap<>();
        List<String> unknown = new ArrayList<>();
        for (Map.Entry<String, CapabilityFlags> entry : grants.entrySet()) {
            if (!resourceCatalog.contains(entry.getKey())) {
                unknown.add(String.valueOf(entry.getKey()));
                continue;
            }
            if (entry.getValue() == null) {
                throw new ProblemException(HttpStatus.BAD_REQUEST, VALIDATION_ERROR,
                        "permissions." + entry.getKey() + " must not be null");
            }
            sorted.put(entry.getKey(), entry.getValue());
        }
        if (!unknown.isEmpty()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, VALIDATION_ERROR,
                    "Unknown resources: " + String.join(", ", unknown));
        }

        userRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "user_not_found", "User not found: " + userId));

        int removed = permissionGrantRepository.deleteAllByUserId(userId);
        List<PermissionGrant> rows = sorted.entrySet().stream()
                .map(entry -> new PermissionGrant(userId, entry.getKey(), entry.getValue()))
                .toList();
        permissionGrantRepository.saveAll(rows);

        log.info("Replaced grants for user {}: removed {}, wrote {}", userId, removed, rows.size());
        return List.copyOf(sorted.keySet());
    }

    @Transactional(readOnly = true)
    public boolean isAllowed(String userId, String resourceName, Capability capability) {
        return permissionGrantRepository.findByIdUserIdAndIdResourceName(userId, resourceName)
                .map(grant -> grant.toFlags().allows(capability))
                .orElse(false);
    }

    public List<String> listManagedResources() {
        return resourceCatalog.list();
    }
}
