package com.mealshift.orderservice.controller;

import com.mealshift.orderservice.dto.PolicyUpdateRequest;
import com.mealshift.orderservice.model.Policy;
import com.mealshift.orderservice.security.CallerIdentity;
import com.mealshift.orderservice.security.CallerIdentityResolver;
import com.mealshift.orderservice.service.PolicyStore;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/policy")
@RequiredArgsConstructor
public class PolicyController {

    private final PolicyStore policyStore;
    private final CallerIdentityResolver identityResolver;

    @GetMapping
    public ResponseEntity<Policy> getPolicy() {
        return ResponseEntity.ok(policyStore.current());
    }

    @PutMapping
    public ResponseEntity<Policy> updatePolicy(
            @Valid @RequestBody PolicyUpdateRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        CallerIdentity caller = identityResolver.resolve(jwt);
        caller.requireAnyRole("policy update", CallerIdentity.ROLE_ADMIN);
        return ResponseEntity.ok(policyStore.update(request, caller.getPersonId()));
    }
}
