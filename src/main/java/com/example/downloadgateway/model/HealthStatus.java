package com.example.downloadgateway.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record HealthStatus(
        String status,
        int workers,
        @JsonProperty("queue_size") int queueSize,
        @JsonProperty("queue_capacity") int queueCapacity,
        @JsonProperty("active_transfers") int activeTransfers) {
}
