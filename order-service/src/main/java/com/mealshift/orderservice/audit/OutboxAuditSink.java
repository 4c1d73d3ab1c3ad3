package com.mealshift.orderservice.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mealshift.common.contracts.AuditRecordContract;
import com.mealshift.orderservice.model.OutboxEvent;
import com.mealshift.orderservice.repository.OutboxRepository;
import com.mealshift.orderservice.time.ClockSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes audit records to the outbox table in the caller's transaction; the
 * OutboxPublisher job forwards them to RabbitMQ.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxAuditSink implements AuditSink {

    private final OutboxRepository outboxRepository;
    private final ObjectMapper objectMapper;
    private final ClockSource clock;

    @Override
    public void record(AuditRecordContract record) {
        try {
            if (record.getOccurredAt() == null) {
                record.setOccurredAt(clock.now());
            }
            OutboxEvent event = OutboxEvent.builder()
                    .aggregateType(record.getEntityType())
                    .aggregateId(record.getEntityId())
                    .type(record.getAction())
                    .payload(objectMapper.writeValueAsString(record))
                    .createdAt(clock.now())
                    .processed(false)
                    .build();
            outboxRepository.save(event);
            log.debug("Audit record queued: action={}, entityId={}", record.getAction(), record.getEntityId());
        } catch (Exception e) {
            log.error("Failed to queue audit record: action={}, entityId={}",
                    record.getAction(), record.getEntityId(), e);
        }
    }
}
