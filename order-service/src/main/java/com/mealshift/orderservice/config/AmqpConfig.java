package com.mealshift.orderservice.config;

import org.springframework.amqp.core.TopicExchange;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AmqpConfig {

    // The audit service owns its queues and binds them to this exchange by action, e.g. "order.#"
    public static final String AUDIT_EXCHANGE = "mealshift_audit_exchange";

    @Bean
    public TopicExchange auditExchange() {
        return new TopicExchange(AUDIT_EXCHANGE);
    }
}
