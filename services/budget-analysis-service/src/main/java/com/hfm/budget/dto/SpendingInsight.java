package com.hfm.budget.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.hfm.budget.domain.SpendingTrend;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SpendingInsight {

    private String category;
    private BigDecimal totalSpent;
    private Integer transactionCount;
    private BigDecimal averageTransaction;
    private SpendingTrend trend;
}
