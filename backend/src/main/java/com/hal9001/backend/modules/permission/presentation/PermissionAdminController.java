package com.hal9001.backend.modules.permission.presentation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.hal9001.backend.modules.permission.application.PermissionService;
import com.hal9001.backend.modules.permission.domain.CapabilityFlags;
import com.hal9001.backend.modules.permission.presentation.dto.GrantFlags;
import com.hal9001.backend.modules.permission.presentation.dto.UpdatePermissionsRequest;
import com.hal9001.backend.modules.permission.presentation.dto.UpdatePermissionsResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/admin")
@Tag(name = "Admin")
public class PermissionAdminController {

    private final PermissionService permissionService;

    public PermissionAdminController(PermissionService permissionService) {
        this.permissionService = permissionService;
    }

    @Operation(summary = "Get permissions for a user")
    @GetMapping("/permissions/{userId}")
    public ResponseEntity<Map<String, GrantFlags>> getPermissions(@PathVariable String userId) {
        Map<String, GrantFlags> body = new LinkedHashMap<>();
        permissionService.getGrants(userId).forEach((resource, flags) -> body.put(resource, GrantFlags.from(flags)));
        return ResponseEntity.ok(body);
    }

    @Operation(summary = "Replace all permissions of a user")
    @PostMapping("/permissions")
    public ResponseEntity<UpdatePermissionsResponse> updatePermissions(@Valid @RequestBody UpdatePermissionsRequest request) {
        Map<String, CapabilityFlags> grants = new LinkedHashMap<>();
        request.permissions().forEach((resource, flags) -> grants.put(resource, flags.toFlags()));
        List<String> written = permissionService.replaceAll(request.userId(), grants);
        return ResponseEntity.ok(UpdatePermissionsResponse.success(request.userId(), written));
    }

    @Operation(summary = "List managed resources")
    @GetMapping("/tables")
    public ResponseEntity<List<String>> listTables() {
        return ResponseEntity.ok(permissionService.listManagedResources());
    }
}
