package com.hfm.budget.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Transaction as returned by the transaction service. Only {@code amount} and {@code category}
 * take part in the analysis; the amount is summed as-is, whatever its sign.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TransactionRecord {

    private Long id;
    private Long userId;
    private Long accountId;
    private BigDecimal amount;
    private String category;
    private String description;
    /** Kept as sent; the analysis never reads it. */
    private String transactionDate;

    public BigDecimal amountOrZero() {
        return amount != null ? amount : BigDecimal.ZERO;
    }

    public String categoryOrEmpty() {
        return category != null ? category : "";
    }
}
