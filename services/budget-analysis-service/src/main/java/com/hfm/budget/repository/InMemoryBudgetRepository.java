package com.hfm.budget.repository;

import com.hfm.budget.domain.Budget;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

@Repository
public class InMemoryBudgetRepository implements BudgetRepository {

    private final Map<Long, Budget> storage = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public Budget save(Budget budget) {
        if (budget.getId() == null) {
            budget.setId(sequence.incrementAndGet());
        }
        storage.put(budget.getId(), budget);
        return budget;
    }

    @Override
    public Optional<Budget> findById(Long budgetId) {
        return Optional.ofNullable(storage.get(budgetId));
    }

    @Override
    public List<Budget> findByUserId(Long userId) {
        return storage.values().stream()
                .filter(budget -> userId.equals(budget.getUserId()))
                .sorted(Comparator.comparing(Budget::getId))
                .collect(Collectors.toCollection(ArrayList::new));
    }
}
