package com.mealshift.orderservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "restrictions", indexes = @Index(name = "idx_restrictions_person", columnList = "person_id, active"))
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class Restriction {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @ToString.Include
    private UUID id;

    @Column(name = "person_id", nullable = false)
    @ToString.Include
    private UUID personId;

    @Column(nullable = false, length = 500)
    private String reason;

    @Column(name = "starts_at", nullable = false)
    private Instant startsAt;

    // null means indefinite
    @Column(name = "ends_at")
    @ToString.Include
    private Instant endsAt;

    // cleared only by an explicit lift; expiry is judged from endsAt at read time
    @Column(nullable = false)
    private boolean active = true;

    @Column(nullable = false)
    private boolean automatic;

    @Column(name = "created_by")
    private UUID createdBy;

    @Column(name = "lifted_at")
    private Instant liftedAt;

    @Column(name = "lifted_by")
    private UUID liftedBy;

    @Column(name = "lift_reason", length = 500)
    private String liftReason;

    @Version
    @Column(name = "version")
    private Long version;

    public boolean isInEffectAt(Instant at) {
        return active && !startsAt.isAfter(at) && (endsAt == null || endsAt.isAfter(at));
    }
}
