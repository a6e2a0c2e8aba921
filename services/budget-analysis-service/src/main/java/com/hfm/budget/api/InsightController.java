package com.hfm.budget.api;

import com.hfm.budget.dto.SpendingInsight;
import com.hfm.budget.service.BudgetAnalysisService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/insights")
@RequiredArgsConstructor
@Slf4j
public class InsightController {

    private final BudgetAnalysisService analysisService;

    @GetMapping("/{userId}/spending")
    public ResponseEntity<List<SpendingInsight>> getSpendingInsights(
            @PathVariable Long userId,
            @RequestParam(defaultValue = "30") int days) {
        log.info("Getting spending insights for user {} over {} days", userId, days);
        return ResponseEntity.ok(analysisService.spendingInsights(userId, days));
    }
}
