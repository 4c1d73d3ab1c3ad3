package com.mealshift.common.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mealshift.common.contracts.AuditRecordContract;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class JacksonConfigTest {

  private final ObjectMapper objectMapper = new JacksonConfig().objectMapper();

  @Test
  void writesInstantsAsIsoStrings() throws Exception {
    AuditRecordContract record = AuditRecordContract.builder()
        .action("order.created")
        .entityType("ORDER")
        .entityId(UUID.randomUUID().toString())
        .occurredAt(Instant.parse("2026-03-10T01:00:00Z"))
        .metadata(Map.of("orderDate", "2026-03-10"))
        .build();

    String json = objectMapper.writeValueAsString(record);

    assertThat(json).contains("\"occurredAt\":\"2026-03-10T01:00:00Z\"");
  }

  @Test
  void toleratesUnknownFieldsFromNewerProducers() throws Exception {
    AuditRecordContract record = objectMapper.readValue(
        "{\"action\":\"order.cancelled\",\"schemaVersion\":2}", AuditRecordContract.class);

    assertThat(record.getAction()).isEqualTo("order.cancelled");
  }
}
