package com.mealshift.orderservice.job;

import com.mealshift.orderservice.event.SubscriberRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class FanoutHeartbeatJob {

  private final SubscriberRegistry subscriberRegistry;

  @Scheduled(fixedDelayString = "${mealshift.fanout.heartbeat-interval:PT15S}")
  public void heartbeat() {
    subscriberRegistry.heartbeat();
  }
}
