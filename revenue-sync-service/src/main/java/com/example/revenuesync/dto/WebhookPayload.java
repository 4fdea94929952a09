package com.example.revenuesync.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request body of {@code POST /webhook}: the batch's records under the {@code data} key.
 */
public record WebhookPayload(@JsonProperty("data") List<MappedRecord> data) {
}
