package com.mealshift.orderservice.job;

import com.mealshift.orderservice.config.AmqpConfig;
import com.mealshift.orderservice.model.OutboxEvent;
import com.mealshift.orderservice.repository.OutboxRepository;
import com.mealshift.orderservice.time.ClockSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

  private final OutboxRepository outboxRepository;
  private final RabbitTemplate rabbitTemplate;
  private final ClockSource clock;

  @Scheduled(fixedDelay = 2000)
  @Transactional
  public void publishOutboxEvents() {
    List<OutboxEvent> events = outboxRepository.findTop50ByProcessedFalseOrderByCreatedAtAsc();

    if (events.isEmpty()) {
      return;
    }

    log.debug("Found {} audit records to publish", events.size());

    for (OutboxEvent event : events) {
      try {
        // payload is already JSON
        MessageProperties props = new MessageProperties();
        props.setContentType(MessageProperties.CONTENT_TYPE_JSON);

        Message message = new Message(event.getPayload().getBytes(StandardCharsets.UTF_8), props);
        rabbitTemplate.send(AmqpConfig.AUDIT_EXCHANGE, event.getType(), message);

        event.setProcessed(true);
        outboxRepository.save(event);

        log.debug("Published audit record: id={}, action={}", event.getId(), event.getType());

      } catch (Exception e) {
        log.error("Failed to publish audit record: id={}", event.getId(), e);
      }
    }
  }

  @Scheduled(cron = "0 0 3 * * *")
  @Transactional
  public void cleanupProcessedEvents() {
    Instant cutoff = clock.now().minus(Duration.ofDays(1));
    log.info("Starting cleanup of published audit records older than {}", cutoff);

    int totalDeleted = 0;
    while (true) {
      List<OutboxEvent> batch = outboxRepository.findTop1000ByProcessedTrueAndCreatedAtBefore(cutoff);
      if (batch.isEmpty()) {
        break;
      }
      outboxRepository.deleteAll(batch);
      totalDeleted += batch.size();
    }

    log.info("Cleanup completed. Total deleted: {}", totalDeleted);
  }
}
