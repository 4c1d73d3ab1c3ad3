package com.mealshift.orderservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;
import java.util.UUID;

/**
 * Local projection of an account owned by the account service. The id is the
 * identity provider subject; the engine only ever writes {@code strikeCount}.
 */
@Entity
@Table(name = "persons")
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class Person {

    @Id
    @ToString.Include
    private UUID id;

    @Column(name = "display_name", length = 200)
    private String displayName;

    @Column(name = "strike_count", nullable = false)
    @ToString.Include
    private int strikeCount;

    @Column(nullable = false)
    private boolean active = true;

    @Column(name = "synced_at")
    private Instant syncedAt;

    @Version
    @Column(name = "version")
    private Long version;
}
