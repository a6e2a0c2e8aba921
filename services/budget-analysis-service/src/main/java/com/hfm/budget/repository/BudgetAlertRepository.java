package com.hfm.budget.repository;

import com.hfm.budget.domain.BudgetAlert;

import java.util.List;

public interface BudgetAlertRepository {

    BudgetAlert save(BudgetAlert alert);

    List<BudgetAlert> findByBudgetId(Long budgetId);
}
