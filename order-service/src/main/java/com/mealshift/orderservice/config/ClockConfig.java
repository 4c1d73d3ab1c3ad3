package com.mealshift.orderservice.config;

import com.mealshift.orderservice.time.ReferenceClockSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class ClockConfig {

    @Bean
    public ReferenceClockSource referenceClockSource(MealshiftProperties properties) {
        MealshiftProperties.ClockSettings clock = properties.getClock();
        return new ReferenceClockSource(Clock.systemUTC(), ZoneId.of(clock.getZone()), clock.isReferenceEnabled());
    }
}
