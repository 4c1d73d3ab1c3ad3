package com.mealshift.orderservice.security;

import com.mealshift.orderservice.config.MealshiftProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Component
@RequiredArgsConstructor
public class CallerIdentityResolver {

    private final MealshiftProperties properties;

    public CallerIdentity resolve(Jwt jwt) {
        if (jwt == null || jwt.getSubject() == null) {
            throw new IllegalArgumentException("Token has no subject");
        }
        UUID personId;
        try {
            personId = UUID.fromString(jwt.getSubject());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Token subject is not a person id: " + jwt.getSubject(), e);
        }
        return new CallerIdentity(personId, extractClientRoles(jwt));
    }

    // resource_access.<clientId>.roles, as issued by Keycloak
    private List<String> extractClientRoles(Jwt jwt) {
        String clientId = properties.getSecurity().getClientId();
        return Optional.ofNullable(jwt.getClaim("resource_access"))
                .filter(Map.class::isInstance)
                .map(claim -> (Map<?, ?>) claim)
                .map(accessMap -> accessMap.get(clientId))
                .filter(Map.class::isInstance)
                .map(client -> (Map<?, ?>) client)
                .map(clientMap -> clientMap.get("roles"))
                .filter(List.class::isInstance)
                .map(roles -> (List<?>) roles)
                .map(list -> list.stream()
                        .filter(String.class::isInstance)
                        .map(String.class::cast)
                        .toList())
                .orElse(List.of());
    }
}
