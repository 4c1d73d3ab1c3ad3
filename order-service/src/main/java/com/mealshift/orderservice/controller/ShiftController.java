package com.mealshift.orderservice.controller;

import com.mealshift.orderservice.dto.HolidayRequest;
import com.mealshift.orderservice.dto.HolidayResponse;
import com.mealshift.orderservice.dto.ShiftRequest;
import com.mealshift.orderservice.dto.ShiftResponse;
import com.mealshift.orderservice.security.CallerIdentity;
import com.mealshift.orderservice.security.CallerIdentityResolver;
import com.mealshift.orderservice.service.ShiftCalendarService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
public class ShiftController {

    private final ShiftCalendarService shiftCalendar;
    private final CallerIdentityResolver identityResolver;

    /**
     * SHIFTS
     */

    @GetMapping("/api/v1/shifts")
    public ResponseEntity<List<ShiftResponse>> getShifts(
            @RequestParam(defaultValue = "true") boolean activeOnly) {
        return ResponseEntity.ok(shiftCalendar.listShifts(activeOnly));
    }

    @PostMapping("/api/v1/shifts")
    public ResponseEntity<ShiftResponse> createShift(
            @Valid @RequestBody ShiftRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        UUID actorId = requireAdmin(jwt, "shift creation");
        return ResponseEntity.status(HttpStatus.CREATED).body(shiftCalendar.createShift(request, actorId));
    }

    @PutMapping("/api/v1/shifts/{shiftId}")
    public ResponseEntity<ShiftResponse> updateShift(
            @PathVariable UUID shiftId,
            @Valid @RequestBody ShiftRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        UUID actorId = requireAdmin(jwt, "shift update");
        return ResponseEntity.ok(shiftCalendar.updateShift(shiftId, request, actorId));
    }

    /**
     * HOLIDAYS
     */

    @GetMapping("/api/v1/holidays")
    public ResponseEntity<List<HolidayResponse>> getHolidays(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ResponseEntity.ok(shiftCalendar.listHolidays(from, to));
    }

    @PostMapping("/api/v1/holidays")
    public ResponseEntity<HolidayResponse> createHoliday(
            @Valid @RequestBody HolidayRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        UUID actorId = requireAdmin(jwt, "holiday creation");
        return ResponseEntity.status(HttpStatus.CREATED).body(shiftCalendar.createHoliday(request, actorId));
    }

    @DeleteMapping("/api/v1/holidays/{holidayId}")
    public ResponseEntity<Void> deleteHoliday(
            @PathVariable UUID holidayId,
            @AuthenticationPrincipal Jwt jwt) {
        UUID actorId = requireAdmin(jwt, "holiday deletion");
        shiftCalendar.deleteHoliday(holidayId, actorId);
        return ResponseEntity.noContent().build();
    }

    private UUID requireAdmin(Jwt jwt, String action) {
        CallerIdentity caller = identityResolver.resolve(jwt);
        caller.requireAnyRole(action, CallerIdentity.ROLE_ADMIN);
        return caller.getPersonId();
    }
}
