package com.mealshift.orderservice.event;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.LocalDate;

@Getter
@RequiredArgsConstructor
public class BookingHorizonReducedEvent {

    private final int previousHorizonDays;
    private final int currentHorizonDays;
    private final LocalDate lastBookableDate;
}
