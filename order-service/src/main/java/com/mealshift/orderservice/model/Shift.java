package com.mealshift.orderservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.LocalTime;
import java.util.UUID;

@Entity
@Table(name = "shifts")
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class Shift {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @ToString.Include
    private UUID id;

    @Column(nullable = false, unique = true, length = 100)
    @ToString.Include
    private String name;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    // Optional meal break; when both are set, collection is only possible during the break
    @Column(name = "break_start_time")
    private LocalTime breakStartTime;

    @Column(name = "break_end_time")
    private LocalTime breakEndTime;

    @Column(nullable = false)
    private boolean active = true;

    @Version
    @Column(name = "version")
    private Long version;

    /**
     * A shift ending at or before its start time finishes on the following day.
     */
    public boolean isOvernight() {
        return !endTime.isAfter(startTime);
    }

    public boolean hasBreak() {
        return breakStartTime != null && breakEndTime != null;
    }
}
