package com.hal9001.backend.modules.admin.presentation;

import java.net.URI;
import java.util.List;

import com.hal9001.backend.modules.admin.presentation.dto.CreateUserRequest;
import com.hal9001.backend.modules.auth.application.ProvisionUserCommand;
import com.hal9001.backend.modules.auth.application.UserAccountService;
import com.hal9001.backend.modules.auth.presentation.dto.UserProfileResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/admin/users")
@Tag(name = "Admin")
public class AdminUserController {

    private final UserAccountService userAccountService;

    public AdminUserController(UserAccountService userAccountService) {
        this.userAccountService = userAccountService;
    }

    @Operation(summary = "List all users ordered by name")
    @GetMapping
    public ResponseEntity<List<UserProfileResponse>> listUsers() {
        return ResponseEntity.ok(userAccountService.listUsers());
    }

    @Operation(summary = "Provision a user")
    @PostMapping
    public ResponseEntity<UserProfileResponse> createUser(@Valid @RequestBody CreateUserRequest request) {
        UserProfileResponse created = userAccountService.provision(new ProvisionUserCommand(
                request.id(),
                request.name(),
                request.role(),
                request.email(),
                request.password()
        ));
        return ResponseEntity.created(URI.create("/api/v1/admin/users/" + created.id())).body(created);
    }
}
