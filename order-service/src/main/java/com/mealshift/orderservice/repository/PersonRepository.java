package com.mealshift.orderservice.repository;

import com.mealshift.orderservice.model.Person;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface PersonRepository extends JpaRepository<Person, UUID> {

    // Row lock taken here is held until commit, so threshold checks for one person run one at a time
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Person p SET p.strikeCount = p.strikeCount + 1, p.version = p.version + 1 WHERE p.id = :id")
    int incrementStrikes(@Param("id") UUID id);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Person p SET p.strikeCount = CASE WHEN p.strikeCount > :amount THEN p.strikeCount - :amount ELSE 0 END, "
            + "p.version = p.version + 1 WHERE p.id = :id")
    int reduceStrikes(@Param("id") UUID id, @Param("amount") int amount);
}
