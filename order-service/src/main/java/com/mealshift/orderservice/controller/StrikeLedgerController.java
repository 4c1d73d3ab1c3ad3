package com.mealshift.orderservice.controller;

import com.mealshift.orderservice.dto.LiftRestrictionRequest;
import com.mealshift.orderservice.dto.PersonStandingResponse;
import com.mealshift.orderservice.dto.RestrictRequest;
import com.mealshift.orderservice.dto.RestrictionResponse;
import com.mealshift.orderservice.dto.StrikeReductionRequest;
import com.mealshift.orderservice.dto.StrikeReductionResponse;
import com.mealshift.orderservice.security.CallerIdentity;
import com.mealshift.orderservice.security.CallerIdentityResolver;
import com.mealshift.orderservice.service.StrikeLedger;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
public class StrikeLedgerController {

    private final StrikeLedger strikeLedger;
    private final CallerIdentityResolver identityResolver;

    @GetMapping("/api/v1/persons/me/standing")
    public ResponseEntity<PersonStandingResponse> getMyStanding(@AuthenticationPrincipal Jwt jwt) {
        CallerIdentity caller = identityResolver.resolve(jwt);
        return ResponseEntity.ok(strikeLedger.standing(caller.getPersonId()));
    }

    @GetMapping("/api/v1/persons/{personId}/standing")
    public ResponseEntity<PersonStandingResponse> getStanding(
            @PathVariable UUID personId,
            @AuthenticationPrincipal Jwt jwt) {
        CallerIdentity caller = identityResolver.resolve(jwt);
        if (!personId.equals(caller.getPersonId())) {
            caller.requireAnyRole("viewing another person's standing", CallerIdentity.ROLE_ADMIN,
                    CallerIdentity.ROLE_CANTEEN);
        }
        return ResponseEntity.ok(strikeLedger.standing(personId));
    }

    @PostMapping("/api/v1/persons/{personId}/strikes/reduce")
    public ResponseEntity<StrikeReductionResponse> reduceStrikes(
            @PathVariable UUID personId,
            @Valid @RequestBody StrikeReductionRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        CallerIdentity caller = requireAdmin(jwt, "strike reduction");
        return ResponseEntity.ok(strikeLedger.reduceStrikes(personId, request.getAmount(), request.isToZero(),
                request.getReason(), caller.getPersonId()));
    }

    @PostMapping("/api/v1/persons/{personId}/restriction")
    public ResponseEntity<PersonStandingResponse> restrict(
            @PathVariable UUID personId,
            @Valid @RequestBody RestrictRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        CallerIdentity caller = requireAdmin(jwt, "restriction");
        return ResponseEntity.ok(strikeLedger.restrict(personId, request.getReason(), request.getDurationDays(),
                caller.getPersonId()));
    }

    @PostMapping("/api/v1/persons/{personId}/restriction/lift")
    public ResponseEntity<PersonStandingResponse> liftRestriction(
            @PathVariable UUID personId,
            @Valid @RequestBody LiftRestrictionRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        CallerIdentity caller = requireAdmin(jwt, "restriction lift");
        return ResponseEntity.ok(strikeLedger.liftRestriction(personId, request.getReason(), caller.getPersonId()));
    }

    @GetMapping("/api/v1/restrictions")
    public ResponseEntity<List<RestrictionResponse>> listRestrictions(
            @RequestParam(defaultValue = "true") boolean inEffectOnly,
            @RequestParam(required = false) UUID personId,
            @AuthenticationPrincipal Jwt jwt) {
        requireAdmin(jwt, "restriction listing");
        return ResponseEntity.ok(strikeLedger.listRestrictions(inEffectOnly, personId));
    }

    private CallerIdentity requireAdmin(Jwt jwt, String action) {
        CallerIdentity caller = identityResolver.resolve(jwt);
        caller.requireAnyRole(action, CallerIdentity.ROLE_ADMIN);
        return caller;
    }
}
