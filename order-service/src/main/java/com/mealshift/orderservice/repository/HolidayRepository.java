package com.mealshift.orderservice.repository;

import com.mealshift.orderservice.model.Holiday;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Repository
public interface HolidayRepository extends JpaRepository<Holiday, UUID> {

    @Query("SELECT CASE WHEN COUNT(h) > 0 THEN true ELSE false END FROM Holiday h WHERE h.date = :date AND (h.shiftId IS NULL OR h.shiftId = :shiftId)")
    boolean closesShiftOn(@Param("date") LocalDate date, @Param("shiftId") UUID shiftId);

    List<Holiday> findByDateBetweenOrderByDateAsc(LocalDate from, LocalDate to);
}
