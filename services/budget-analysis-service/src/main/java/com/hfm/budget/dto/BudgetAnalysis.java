package com.hfm.budget.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.hfm.budget.domain.BudgetStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Spend analysis of one budget, recomputed on every request.
 *
 * <p>When the budget's transactions could not be fetched the spend metrics and status are absent
 * and {@code upstreamError} says why; such an entry is never a zero-spend budget.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BudgetAnalysis {

    private Long budgetId;
    private String budgetName;
    private BigDecimal budgetAmount;
    private BigDecimal spentAmount;
    private BigDecimal remainingAmount;
    private BigDecimal percentageUsed;
    private Integer daysRemaining;
    private BudgetStatus status;
    private String upstreamError;

    public boolean isAnalyzed() {
        return upstreamError == null;
    }
}
