package com.schoolmate.backend.global.config;

import java.util.Optional;
import java.util.UUID;

import com.schoolmate.backend.global.security.JwtAuthenticationPrincipal;
import com.schoolmate.backend.global.security.SecurityUtils;

import org.springframework.data.domain.AuditorAware;
import org.springframework.lang.NonNull;

/**
 * Fills {@code created_by} and {@code updated_by} on schools and administrators with the user id of
 * whoever made the change. Seeding and scheduled work leave both columns null.
 */
public class SchoolmateAuditorAware implements AuditorAware<UUID> {

    @Override
    @NonNull
    public Optional<UUID> getCurrentAuditor() {
        return SecurityUtils.findCurrentPrincipal().map(JwtAuthenticationPrincipal::userId);
    }
}
