package com.schoolmate.backend.global.security;

import java.util.Optional;

import com.schoolmate.backend.global.error.ProblemException;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Access to the administrator or platform operator bound to the current request thread.
 */
public final class SecurityUtils {

    private SecurityUtils() {
    }

    /**
     * The caller behind the current request, or empty on scheduler and startup threads.
     */
    public static Optional<JwtAuthenticationPrincipal> findCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.isAuthenticated()
                && authentication.getPrincipal() instanceof JwtAuthenticationPrincipal principal) {
            return Optional.of(principal);
        }
        return Optional.empty();
    }

    public static JwtAuthenticationPrincipal getCurrentPrincipal() {
        return findCurrentPrincipal()
                .orElseThrow(() -> ProblemException.unauthenticated("Sign in to access school administration."));
    }
}
