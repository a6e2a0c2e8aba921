package com.hfm.budget.repository;

import com.hfm.budget.domain.Budget;

import java.util.List;
import java.util.Optional;

public interface BudgetRepository {

    /**
     * Stores the budget, assigning an id when it has none.
     */
    Budget save(Budget budget);

    Optional<Budget> findById(Long budgetId);

    /**
     * The user's budgets in creation order.
     */
    List<Budget> findByUserId(Long userId);
}
