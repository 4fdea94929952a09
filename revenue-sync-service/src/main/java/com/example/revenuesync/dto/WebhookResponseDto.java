package com.example.revenuesync.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional JSON body returned by the webhook on success.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class WebhookResponseDto {

    private int inserted;
    private int updated;
    private int total;
}
