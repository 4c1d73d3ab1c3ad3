package com.mealshift.orderservice.controller;

import com.mealshift.orderservice.dto.FanoutStatusResponse;
import com.mealshift.orderservice.event.SubscriberRegistry;
import com.mealshift.orderservice.security.CallerIdentity;
import com.mealshift.orderservice.security.CallerIdentityResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/events")
@RequiredArgsConstructor
public class EventStreamController {

    private final SubscriberRegistry subscriberRegistry;
    private final CallerIdentityResolver identityResolver;

    // clientToken lets a browser tab be told apart from another tab of the same person
    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(
            @RequestParam(required = false) String clientToken,
            @AuthenticationPrincipal Jwt jwt) {
        CallerIdentity caller = identityResolver.resolve(jwt);
        String token = clientToken == null || clientToken.isBlank() ? UUID.randomUUID().toString() : clientToken;
        return subscriberRegistry.register(token, caller.getPersonId(), caller.primaryRole());
    }

    @GetMapping("/status")
    public ResponseEntity<FanoutStatusResponse> status(@AuthenticationPrincipal Jwt jwt) {
        identityResolver.resolve(jwt).requireAnyRole("event stream status", CallerIdentity.ROLE_ADMIN);
        return ResponseEntity.ok(subscriberRegistry.status());
    }
}
