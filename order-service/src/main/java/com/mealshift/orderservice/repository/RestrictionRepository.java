package com.mealshift.orderservice.repository;

import com.mealshift.orderservice.model.Restriction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface RestrictionRepository extends JpaRepository<Restriction, UUID> {

    @Query("SELECT r FROM Restriction r WHERE r.personId = :personId AND r.active = true "
            + "AND r.startsAt <= :at AND (r.endsAt IS NULL OR r.endsAt > :at) ORDER BY r.startsAt DESC")
    List<Restriction> findInEffectAt(@Param("personId") UUID personId, @Param("at") Instant at);

    default Optional<Restriction> findCurrent(UUID personId, Instant at) {
        return findInEffectAt(personId, at).stream().findFirst();
    }

    @Query("SELECT CASE WHEN COUNT(r) > 0 THEN true ELSE false END FROM Restriction r WHERE r.personId = :personId AND r.active = true "
            + "AND r.startsAt <= :at AND (r.endsAt IS NULL OR r.endsAt > :at)")
    boolean existsInEffectAt(@Param("personId") UUID personId, @Param("at") Instant at);

    @Query("SELECT r FROM Restriction r WHERE r.active = true AND r.startsAt <= :at "
            + "AND (r.endsAt IS NULL OR r.endsAt > :at) ORDER BY r.startsAt DESC")
    List<Restriction> findAllInEffectAt(@Param("at") Instant at);

    List<Restriction> findAllByOrderByStartsAtDesc();

    List<Restriction> findByPersonIdOrderByStartsAtDesc(UUID personId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Restriction r SET r.active = false, r.liftedAt = :at, r.liftedBy = :liftedBy, r.liftReason = :reason, "
            + "r.version = r.version + 1 WHERE r.personId = :personId AND r.active = true "
            + "AND (r.endsAt IS NULL OR r.endsAt > :at)")
    int liftInEffect(@Param("personId") UUID personId,
                     @Param("at") Instant at,
                     @Param("liftedBy") UUID liftedBy,
                     @Param("reason") String reason);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Restriction r SET r.active = false, r.liftedAt = :at, r.liftedBy = :liftedBy, r.liftReason = :reason, "
            + "r.version = r.version + 1 WHERE r.personId = :personId AND r.active = true AND r.automatic = true "
            + "AND (r.endsAt IS NULL OR r.endsAt > :at)")
    int liftAutomaticInEffect(@Param("personId") UUID personId,
                              @Param("at") Instant at,
                              @Param("liftedBy") UUID liftedBy,
                              @Param("reason") String reason);
}
