package com.mealshift.orderservice.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Data
@Builder
public class FanoutStatusResponse {
    private int openConnections;
    private long distinctClients;
    private Map<String, Long> connectionsByRole;
    private List<Connection> connections;

    @Data
    @Builder
    public static class Connection {
        private String connectionId;
        private String clientToken;
        private UUID personId;
        private String role;
        private Instant connectedAt;
    }
}
