package com.mealshift.orderservice.repository;

import com.mealshift.orderservice.model.PolicySettings;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PolicySettingsRepository extends JpaRepository<PolicySettings, String> {
}
