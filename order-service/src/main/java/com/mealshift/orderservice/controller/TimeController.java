package com.mealshift.orderservice.controller;

import com.mealshift.orderservice.dto.ServerTimeResponse;
import com.mealshift.orderservice.time.ClockSource;
import com.mealshift.orderservice.time.ReferenceClockSource;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Lets clients align countdowns with the engine's notion of "now".
 */
@RestController
@RequestMapping("/api/v1/time")
@RequiredArgsConstructor
public class TimeController {

    private final ClockSource clock;

    @GetMapping
    public ResponseEntity<ServerTimeResponse> getServerTime() {
        Instant now = clock.now();
        ServerTimeResponse.ServerTimeResponseBuilder response = ServerTimeResponse.builder()
                .serverTime(now)
                .zone(clock.zone().getId())
                .today(LocalDate.ofInstant(now, clock.zone()));
        if (clock instanceof ReferenceClockSource reference) {
            response.referenceEnabled(reference.isReferenceEnabled())
                    .offsetMillis(reference.offsetMillis())
                    .lastSyncAt(reference.lastSyncAt());
        }
        return ResponseEntity.ok(response.build());
    }
}
