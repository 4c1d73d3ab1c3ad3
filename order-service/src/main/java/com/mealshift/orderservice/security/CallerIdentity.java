package com.mealshift.orderservice.security;

import com.mealshift.common.exception.AccessDeniedException;
import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.UUID;

/**
 * Who is calling: the person id from the token subject plus the client roles.
 */
@Getter
public class CallerIdentity {

    public static final String ROLE_USER = "USER";
    public static final String ROLE_CANTEEN = "CANTEEN";
    public static final String ROLE_ADMIN = "ADMIN";
    public static final String ROLE_SERVICE = "SERVICE";

    private final UUID personId;
    private final List<String> roles;

    public CallerIdentity(UUID personId, List<String> roles) {
        this.personId = personId;
        this.roles = List.copyOf(roles);
    }

    public boolean hasRole(String role) {
        return roles.contains(role);
    }

    public boolean hasAnyRole(String... candidates) {
        return Arrays.stream(candidates).anyMatch(roles::contains);
    }

    public boolean isAdmin() {
        return hasRole(ROLE_ADMIN);
    }

    /**
     * Staff may see and act on orders that are not their own.
     */
    public boolean isStaff() {
        return hasAnyRole(ROLE_ADMIN, ROLE_CANTEEN);
    }

    public String primaryRole() {
        if (isAdmin()) {
            return ROLE_ADMIN;
        }
        if (hasRole(ROLE_CANTEEN)) {
            return ROLE_CANTEEN;
        }
        return ROLE_USER;
    }

    public void requireAnyRole(String action, String... required) {
        if (!hasAnyRole(required)) {
            throw new AccessDeniedException("Access Denied: " + action + " requires one of " + Arrays.toString(required));
        }
    }
}
