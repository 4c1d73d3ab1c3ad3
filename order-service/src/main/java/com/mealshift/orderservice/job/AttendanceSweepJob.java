package com.mealshift.orderservice.job;

import com.mealshift.orderservice.config.MealshiftProperties;
import com.mealshift.orderservice.service.AttendanceSweeper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class AttendanceSweepJob {

  private final AttendanceSweeper attendanceSweeper;
  private final MealshiftProperties properties;

  @Scheduled(fixedDelayString = "${mealshift.sweep.interval:PT5M}", initialDelayString = "PT30S")
  public void run() {
    if (!properties.getSweep().isEnabled()) {
      return;
    }
    try {
      attendanceSweeper.sweep();
    } catch (RuntimeException e) {
      // next trigger picks up whatever was left
      log.error("Scheduled attendance sweep failed", e);
    }
  }
}
