package com.hal9001.backend.modules.auth.presentation;

import com.hal9001.backend.global.security.SecurityUtils;
import com.hal9001.backend.modules.auth.application.AuthService;
import com.hal9001.backend.modules.auth.application.TokenService.IssuedToken;
import com.hal9001.backend.modules.auth.application.UserAccountService;
import com.hal9001.backend.modules.auth.presentation.dto.ChangePasswordRequest;
import com.hal9001.backend.modules.auth.presentation.dto.TokenRequest;
import com.hal9001.backend.modules.auth.presentation.dto.TokenResponse;
import com.hal9001.backend.modules.auth.presentation.dto.UserProfileResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/auth")
@Tag(name = "Auth")
public class AuthController {

    private final AuthService authService;
    private final UserAccountService userAccountService;

    public AuthController(AuthService authService, UserAccountService userAccountService) {
        this.authService = authService;
        this.userAccountService = userAccountService;
    }

    @Operation(summary = "Exchange email and password for a bearer token")
    @PostMapping(value = "/token", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ResponseEntity<TokenResponse> issueToken(@Valid @ModelAttribute TokenRequest request) {
        IssuedToken token = authService.authenticate(request.username(), request.password());
        return ResponseEntity.ok(TokenResponse.bearer(token.token(), token.expiresInSeconds()));
    }

    @Operation(summary = "Profile of the authenticated caller")
    @GetMapping("/me")
    public ResponseEntity<UserProfileResponse> me() {
        return ResponseEntity.ok(userAccountService.loadProfile(SecurityUtils.getCurrentUserId()));
    }

    @Operation(summary = "Change the caller's own password")
    @PostMapping("/password")
    public ResponseEntity<Void> changePassword(@Valid @RequestBody ChangePasswordRequest request) {
        userAccountService.changePassword(SecurityUtils.getCurrentUserId(), request.currentPassword(), request.newPassword());
        return ResponseEntity.noContent().build();
    }
}
