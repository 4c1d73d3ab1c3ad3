package com.mealshift.orderservice.time;

import com.fasterxml.jackson.databind.JsonNode;
import com.mealshift.orderservice.config.MealshiftProperties;
import com.mealshift.orderservice.exception.ExternalServiceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.function.Supplier;

/**
 * Reads the current time from a worldtimeapi-style JSON endpoint and turns it into
 * an offset against the local clock, halving the round trip as latency compensation.
 */
@Component
@Slf4j
public class TimeReferenceClient {

    private final WebClient webClient;
    private final MealshiftProperties properties;

    public TimeReferenceClient(@Qualifier("timeReferenceWebClient") WebClient webClient,
                               MealshiftProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    public long fetchOffsetMillis(Supplier<Instant> localClock) {
        MealshiftProperties.ClockSettings settings = properties.getClock();
        Instant sentAt = localClock.get();
        JsonNode body;
        try {
            body = webClient.get()
                    .uri(settings.getReferenceUrl())
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(settings.getTimeout());
        } catch (RuntimeException e) {
            throw new ExternalServiceException("Time reference unreachable: " + settings.getReferenceUrl(), e);
        }
        Instant receivedAt = localClock.get();

        Instant serverTime = parseServerTime(body);
        long latency = Duration.between(sentAt, receivedAt).toMillis();
        long offset = serverTime.toEpochMilli() - receivedAt.toEpochMilli() + latency / 2;
        log.debug("Time reference sampled: serverTime={}, latencyMs={}, offsetMs={}", serverTime, latency, offset);
        return offset;
    }

    static Instant parseServerTime(JsonNode body) {
        if (body == null) {
            throw new ExternalServiceException("Time reference returned an empty body");
        }
        if (body.hasNonNull("utc_datetime")) {
            return OffsetDateTime.parse(body.get("utc_datetime").asText()).toInstant();
        }
        if (body.hasNonNull("datetime")) {
            return OffsetDateTime.parse(body.get("datetime").asText()).toInstant();
        }
        if (body.hasNonNull("unixtime")) {
            return Instant.ofEpochSecond(body.get("unixtime").asLong());
        }
        throw new ExternalServiceException("Time reference response has no recognised time field");
    }
}
