package com.mealshift.orderservice.job;

import com.mealshift.orderservice.time.ReferenceClockSource;
import com.mealshift.orderservice.time.TimeReferenceClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class ClockSyncJob {

  private final ReferenceClockSource clockSource;
  private final TimeReferenceClient timeReferenceClient;

  @Scheduled(fixedDelayString = "${mealshift.clock.sync-interval:PT1H}", initialDelayString = "PT5S")
  public void synchronize() {
    if (!clockSource.isReferenceEnabled()) {
      return;
    }
    try {
      long offset = timeReferenceClient.fetchOffsetMillis(clockSource::localNow);
      clockSource.applyOffset(offset);
      log.debug("Clock synchronized: offsetMs={}", offset);
    } catch (RuntimeException e) {
      // keep serving with the last known offset
      log.warn("Clock synchronization failed, keeping offsetMs={}: {}", clockSource.offsetMillis(), e.getMessage());
    }
  }
}
