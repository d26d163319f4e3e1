package com.hal9001.backend.global.security;

import com.hal9001.backend.modules.auth.application.UnauthenticatedException;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static JwtAuthenticationPrincipal getCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof JwtAuthenticationPrincipal principal)) {
            throw new UnauthenticatedException();
        }
        return principal;
    }

    public static String getCurrentUserId() {
        return getCurrentPrincipal().userId();
    }
}
