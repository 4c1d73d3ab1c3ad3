package com.mealshift.orderservice.controller;

import com.mealshift.orderservice.dto.PersonStandingResponse;
import com.mealshift.orderservice.dto.PersonSyncRequest;
import com.mealshift.orderservice.security.CallerIdentity;
import com.mealshift.orderservice.security.CallerIdentityResolver;
import com.mealshift.orderservice.service.PersonDirectoryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Called by the account service whenever a person is created or changed.
 */
@RestController
@RequestMapping("/internal/v1/persons")
@RequiredArgsConstructor
public class PersonInternalController {

    private final PersonDirectoryService personDirectory;
    private final CallerIdentityResolver identityResolver;

    @PutMapping("/{personId}")
    public ResponseEntity<PersonStandingResponse> syncPerson(
            @PathVariable UUID personId,
            @Valid @RequestBody PersonSyncRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        identityResolver.resolve(jwt).requireAnyRole("person sync", CallerIdentity.ROLE_SERVICE,
                CallerIdentity.ROLE_ADMIN);
        return ResponseEntity.ok(personDirectory.upsert(personId, request));
    }
}
