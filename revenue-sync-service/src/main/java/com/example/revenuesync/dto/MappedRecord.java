package com.example.revenuesync.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One record in the webhook payload.
 * The JSON key set is fixed by the receiving endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({"Customer", "Group", "Entity", "TJ", "Date", "Amount", "Currency", "Status", "Margin"})
public class MappedRecord {

    @JsonProperty("Customer")
    private String customer;

    @JsonProperty("Group")
    private String group;

    @JsonProperty("Entity")
    private String entity;

    @JsonProperty("TJ")
    private String transactionId;

    @JsonProperty("Date")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime date;

    @JsonProperty("Amount")
    private BigDecimal amount;

    @JsonProperty("Currency")
    private String currency;

    @JsonProperty("Status")
    private String status;

    /** Gross margin as stored in the source, in percent. */
    @JsonProperty("Margin")
    private BigDecimal margin;
}
