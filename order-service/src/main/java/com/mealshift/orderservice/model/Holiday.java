package com.mealshift.orderservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "holidays", indexes = @Index(name = "idx_holidays_date", columnList = "holiday_date"))
@Getter
@Setter
public class Holiday {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "holiday_date", nullable = false)
    private LocalDate date;

    // null closes every shift on that date
    @Column(name = "shift_id")
    private UUID shiftId;

    @Column(nullable = false, length = 200)
    private String description;
}
