package com.hfm.budget.api;

import com.hfm.budget.domain.Budget;
import com.hfm.budget.domain.BudgetAlert;
import com.hfm.budget.dto.BudgetAnalysis;
import com.hfm.budget.dto.BudgetCreateRequest;
import com.hfm.budget.service.BudgetAnalysisService;
import com.hfm.budget.service.BudgetService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/budgets")
@RequiredArgsConstructor
@Slf4j
public class BudgetController {

    private final BudgetService budgetService;
    private final BudgetAnalysisService analysisService;

    @PostMapping
    public ResponseEntity<Budget> createBudget(@RequestParam("user_id") Long userId,
                                               @Valid @RequestBody BudgetCreateRequest request) {
        log.info("Creating {} budget '{}' for user {}", request.getCategory(), request.getName(), userId);
        return ResponseEntity.ok(budgetService.createBudget(userId, request));
    }

    @GetMapping("/{userId}")
    public ResponseEntity<List<Budget>> getUserBudgets(@PathVariable Long userId) {
        return ResponseEntity.ok(budgetService.getUserBudgets(userId));
    }

    @GetMapping("/{userId}/analysis")
    public ResponseEntity<List<BudgetAnalysis>> analyzeBudgets(@PathVariable Long userId) {
        log.info("Analyzing budgets for user {}", userId);
        List<Budget> budgets = budgetService.getUserBudgets(userId);
        return ResponseEntity.ok(analysisService.analyze(userId, budgets));
    }

    @PostMapping("/{budgetId}/alerts")
    public ResponseEntity<Map<String, Object>> createBudgetAlert(@PathVariable Long budgetId,
                                                                 @RequestParam("alert_type") String alertType,
                                                                 @RequestParam String message) {
        BudgetAlert alert = budgetService.createAlert(budgetId, alertType, message);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Alert created successfully");
        body.put("alert_id", alert.getId());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{budgetId}/alerts")
    public ResponseEntity<List<BudgetAlert>> getBudgetAlerts(@PathVariable Long budgetId) {
        return ResponseEntity.ok(budgetService.getAlerts(budgetId));
    }
}
