package com.mealshift.orderservice.repository;

import com.mealshift.orderservice.model.Order;
import com.mealshift.orderservice.model.OrderStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface OrderRepository extends JpaRepository<Order, UUID> {

    Optional<Order> findByPickupCode(String pickupCode);

    boolean existsByPersonIdAndOrderDateAndStatusNot(UUID personId, LocalDate orderDate, OrderStatus status);

    List<Order> findByOrderDateBetweenOrderByOrderDateAscCreatedAtAsc(LocalDate from, LocalDate to);

    List<Order> findByPersonIdAndOrderDateBetweenOrderByOrderDateAscCreatedAtAsc(UUID personId, LocalDate from,
            LocalDate to);

    // sweep candidates: anything still open on or before the given date
    List<Order> findByStatusAndOrderDateLessThanEqual(OrderStatus status, LocalDate date);

    List<Order> findByPersonIdAndStatusAndOrderDateGreaterThanEqual(UUID personId, OrderStatus status,
            LocalDate date);

    List<Order> findByStatusAndOrderDateAfter(OrderStatus status, LocalDate date);

    @Query("SELECT o.status, COUNT(o) FROM Order o WHERE o.orderDate BETWEEN :from AND :to GROUP BY o.status")
    List<Object[]> countByStatusBetween(@Param("from") LocalDate from, @Param("to") LocalDate to);

    // Conditional transitions: each applies only while the stored status still equals :expected.
    // A return value of 0 means another request or sweep got there first.

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Order o SET o.status = :status, o.collectedAt = :at, o.collectedBy = :collectedBy, "
            + "o.collectionPoint = :collectionPoint, o.version = o.version + 1 "
            + "WHERE o.id = :id AND o.status = :expected")
    int markCollected(@Param("id") UUID id,
                      @Param("expected") OrderStatus expected,
                      @Param("status") OrderStatus status,
                      @Param("at") Instant at,
                      @Param("collectedBy") UUID collectedBy,
                      @Param("collectionPoint") String collectionPoint);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Order o SET o.status = :status, o.cancelledAt = :at, o.cancelledBy = :cancelledBy, "
            + "o.cancelReason = :reason, o.lateCancellation = :late, o.liveDate = NULL, o.version = o.version + 1 "
            + "WHERE o.id = :id AND o.status = :expected")
    int markCancelled(@Param("id") UUID id,
                      @Param("expected") OrderStatus expected,
                      @Param("status") OrderStatus status,
                      @Param("at") Instant at,
                      @Param("cancelledBy") UUID cancelledBy,
                      @Param("reason") String reason,
                      @Param("late") boolean late);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Order o SET o.status = :status, o.notCollectedAt = :at, o.version = o.version + 1 "
            + "WHERE o.id = :id AND o.status = :expected")
    int markNotCollected(@Param("id") UUID id,
                         @Param("expected") OrderStatus expected,
                         @Param("status") OrderStatus status,
                         @Param("at") Instant at);
}
