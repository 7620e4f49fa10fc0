package com.devstore.global.security;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.Optional;
import java.util.UUID;

public final class SecurityUtil {

    private SecurityUtil() {}

    public static Optional<UUID> getCurrentCustomerId() {
        return getCurrentCustomer().map(CustomerPrincipal::getCustomerId);
    }

    public static Optional<CustomerPrincipal> getCurrentCustomer() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth != null && auth.getPrincipal() instanceof CustomerPrincipal principal) {
            return Optional.of(principal);
        }
        return Optional.empty();
    }
}
