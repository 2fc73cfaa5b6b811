package com.orgscope.backend.global.config;

import java.util.Optional;
import java.util.UUID;

import com.orgscope.backend.global.security.ActorPrincipal;

import org.springframework.data.domain.AuditorAware;
import org.springframework.lang.NonNull;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Resolves the current auditor (acting member id) for JPA auditing.
 * Falls back to {@code Optional.empty()} when no actor is bound to the request.
 */
public class ActorAuditorAware implements AuditorAware<UUID> {

    @Override
    @NonNull
    public Optional<UUID> getCurrentAuditor() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !authentication.isAuthenticated()) {
            return Optional.empty();
        }
        if (authentication.getPrincipal() instanceof ActorPrincipal actor) {
            return Optional.ofNullable(actor.actorId());
        }
        return Optional.empty();
    }
}
