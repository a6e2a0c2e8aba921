package com.hfm.budget.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;

public enum BudgetStatus {
    ON_TRACK("on_track"),
    AT_RISK("at_risk"),
    OVER_BUDGET("over_budget");

    public static final BigDecimal AT_RISK_THRESHOLD = new BigDecimal("80");
    public static final BigDecimal OVER_BUDGET_THRESHOLD = new BigDecimal("100");

    private final String code;

    BudgetStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * First match wins: 100% or more is over budget, 80% or more is at risk.
     */
    public static BudgetStatus fromPercentageUsed(BigDecimal percentageUsed) {
        if (percentageUsed.compareTo(OVER_BUDGET_THRESHOLD) >= 0) {
            return OVER_BUDGET;
        }
        if (percentageUsed.compareTo(AT_RISK_THRESHOLD) >= 0) {
            return AT_RISK;
        }
        return ON_TRACK;
    }
}
