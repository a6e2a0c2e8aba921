package com.hfm.budget.repository;

import com.hfm.budget.domain.BudgetAlert;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

@Repository
public class InMemoryBudgetAlertRepository implements BudgetAlertRepository {

    private final Map<Long, BudgetAlert> storage = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public BudgetAlert save(BudgetAlert alert) {
        if (alert.getId() == null) {
            alert.setId(sequence.incrementAndGet());
        }
        storage.put(alert.getId(), alert);
        return alert;
    }

    @Override
    public List<BudgetAlert> findByBudgetId(Long budgetId) {
        return storage.values().stream()
                .filter(alert -> budgetId.equals(alert.getBudgetId()))
                .sorted(Comparator.comparing(BudgetAlert::getId))
                .collect(Collectors.toCollection(ArrayList::new));
    }
}
