package com.mealshift.orderservice.controller;

import com.mealshift.orderservice.dto.SweepResult;
import com.mealshift.orderservice.security.CallerIdentity;
import com.mealshift.orderservice.security.CallerIdentityResolver;
import com.mealshift.orderservice.service.AttendanceSweeper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/admin/attendance")
@RequiredArgsConstructor
@Slf4j
public class AttendanceController {

    private final AttendanceSweeper attendanceSweeper;
    private final CallerIdentityResolver identityResolver;

    @PostMapping("/sweep")
    public ResponseEntity<SweepResult> sweep(@AuthenticationPrincipal Jwt jwt) {
        CallerIdentity caller = identityResolver.resolve(jwt);
        caller.requireAnyRole("manual attendance sweep", CallerIdentity.ROLE_ADMIN);
        log.info("Manual attendance sweep triggered by {}", caller.getPersonId());
        return ResponseEntity.ok(attendanceSweeper.sweep());
    }
}
