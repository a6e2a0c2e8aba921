package com.hfm.budget.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SpendingTrend {
    INCREASING("increasing"),
    DECREASING("decreasing"),
    STABLE("stable");

    private final String code;

    SpendingTrend(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
