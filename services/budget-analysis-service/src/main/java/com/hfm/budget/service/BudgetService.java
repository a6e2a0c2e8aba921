package com.hfm.budget.service;

import com.hfm.budget.domain.Budget;
import com.hfm.budget.domain.BudgetAlert;
import com.hfm.budget.dto.BudgetCreateRequest;
import com.hfm.budget.exception.BudgetNotFoundException;
import com.hfm.budget.repository.BudgetAlertRepository;
import com.hfm.budget.repository.BudgetRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Budget and budget alert bookkeeping.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BudgetService {

    private final BudgetRepository budgetRepository;
    private final BudgetAlertRepository alertRepository;
    private final Clock clock;

    public Budget createBudget(Long userId, BudgetCreateRequest request) {
        Budget budget = Budget.builder()
                .userId(userId)
                .name(request.getName())
                .category(request.getCategory())
                .amount(request.getAmount())
                .period(request.getPeriod())
                .startDate(request.getStartDate())
                .endDate(request.getEndDate())
                .createdAt(LocalDateTime.now(clock))
                .build();

        Budget saved = budgetRepository.save(budget);
        log.info("Created budget {} ({}) for user {}", saved.getId(), saved.getCategory(), userId);
        return saved;
    }

    public List<Budget> getUserBudgets(Long userId) {
        return budgetRepository.findByUserId(userId);
    }

    /**
     * Records an alert against an existing budget. The alert belongs to the budget's owner.
     *
     * @throws BudgetNotFoundException if no budget has the given id
     */
    public BudgetAlert createAlert(Long budgetId, String alertType, String message) {
        Budget budget = budgetRepository.findById(budgetId)
                .orElseThrow(() -> new BudgetNotFoundException(budgetId));

        BudgetAlert alert = BudgetAlert.builder()
                .budgetId(budgetId)
                .userId(budget.getUserId())
                .alertType(alertType)
                .message(message)
                .triggeredAt(LocalDateTime.now(clock))
                .read(false)
                .build();

        BudgetAlert saved = alertRepository.save(alert);
        log.info("Recorded {} alert {} for budget {}", alertType, saved.getId(), budgetId);
        return saved;
    }

    public List<BudgetAlert> getAlerts(Long budgetId) {
        if (budgetRepository.findById(budgetId).isEmpty()) {
            throw new BudgetNotFoundException(budgetId);
        }
        return alertRepository.findByBudgetId(budgetId);
    }
}
