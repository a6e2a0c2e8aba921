package com.hfm.budget.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A user's spending ceiling for one category between {@code startDate} and {@code endDate}.
 * Dates are UTC wall-clock times. An end before the start is tolerated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Budget {

    private Long id;
    private Long userId;
    private String name;
    private String category;
    private BigDecimal amount;
    private BudgetPeriod period;
    private LocalDateTime startDate;
    private LocalDateTime endDate;
    private LocalDateTime createdAt;
}
