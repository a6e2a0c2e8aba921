package com.hfm.budget.exception;

public class BudgetNotFoundException extends RuntimeException {

    private final Long budgetId;

    public BudgetNotFoundException(Long budgetId) {
        super("Budget not found: " + budgetId);
        this.budgetId = budgetId;
    }

    public Long getBudgetId() {
        return budgetId;
    }
}
