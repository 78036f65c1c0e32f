package dev.regula.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Body of {@code GET /health}. */
public record HealthResponse(
    String status,
    @JsonProperty("index_ready") boolean indexReady,
    @JsonProperty("chunk_count") int chunkCount) {}
