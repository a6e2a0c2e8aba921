package com.hfm.budget.engine;

import com.hfm.budget.domain.Budget;
import com.hfm.budget.domain.BudgetStatus;
import com.hfm.budget.domain.SpendingTrend;
import com.hfm.budget.dto.BudgetAnalysis;
import com.hfm.budget.dto.SpendingInsight;
import com.hfm.budget.dto.TransactionRecord;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derives budget analyses and category insights from transaction records. Pure: no I/O, no clock;
 * callers supply the transactions and "now".
 */
public class BudgetAnalysisEngine {

    /**
     * Trend reported for every insight. No historical baseline is computed, so increasing and
     * decreasing are never produced until insights also fetch the preceding window.
     */
    public static final SpendingTrend UNCOMPUTED_TREND = SpendingTrend.STABLE;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final long SECONDS_PER_DAY = Duration.ofDays(1).getSeconds();

    /**
     * Analyzes one budget against the transactions fetched for its window. Only transactions whose
     * category equals the budget's, ignoring case, count towards the spend. The percentage used is
     * reported unrounded, to 34 significant digits.
     */
    public BudgetAnalysis analyze(Budget budget, List<TransactionRecord> transactions, LocalDateTime now) {
        BigDecimal amount = budget.getAmount() != null ? budget.getAmount() : BigDecimal.ZERO;
        BigDecimal spent = transactions.stream()
                .filter(transaction -> matchesCategory(transaction, budget.getCategory()))
                .map(TransactionRecord::amountOrZero)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal percentageUsed = percentageUsed(spent, amount);

        return BudgetAnalysis.builder()
                .budgetId(budget.getId())
                .budgetName(budget.getName())
                .budgetAmount(amount)
                .spentAmount(spent)
                .remainingAmount(amount.subtract(spent))
                .percentageUsed(percentageUsed)
                .daysRemaining(daysRemaining(now, budget.getEndDate()))
                .status(BudgetStatus.fromPercentageUsed(percentageUsed))
                .build();
    }

    /**
     * Entry for a budget whose transactions could not be fetched.
     */
    public BudgetAnalysis failed(Budget budget, String reason) {
        return BudgetAnalysis.builder()
                .budgetId(budget.getId())
                .budgetName(budget.getName())
                .budgetAmount(budget.getAmount())
                .upstreamError(reason)
                .build();
    }

    /**
     * Groups transactions by their exact category label and sorts the groups by total spent,
     * largest first. Records without a category are left out. Equal totals keep category order.
     */
    public List<SpendingInsight> summarizeByCategory(List<TransactionRecord> transactions) {
        Map<String, List<TransactionRecord>> byCategory = new TreeMap<>();
        for (TransactionRecord transaction : transactions) {
            if (transaction.getCategory() == null) {
                continue;
            }
            byCategory.computeIfAbsent(transaction.getCategory(), category -> new ArrayList<>()).add(transaction);
        }

        List<SpendingInsight> insights = new ArrayList<>(byCategory.size());
        byCategory.forEach((category, group) -> {
            BigDecimal total = group.stream()
                    .map(TransactionRecord::amountOrZero)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            BigDecimal average = total.divide(BigDecimal.valueOf(group.size()), MathContext.DECIMAL128);
            insights.add(SpendingInsight.builder()
                    .category(category)
                    .totalSpent(total.setScale(2, RoundingMode.HALF_EVEN))
                    .transactionCount(group.size())
                    .averageTransaction(average.setScale(2, RoundingMode.HALF_EVEN))
                    .trend(UNCOMPUTED_TREND)
                    .build());
        });

        // List.sort is stable
        insights.sort(Comparator.comparing(SpendingInsight::getTotalSpent).reversed());
        return insights;
    }

    static boolean matchesCategory(TransactionRecord transaction, String budgetCategory) {
        return budgetCategory != null && budgetCategory.equalsIgnoreCase(transaction.categoryOrEmpty());
    }

    /**
     * Zero when the budget amount is not positive, otherwise spent / amount * 100, uncapped.
     */
    static BigDecimal percentageUsed(BigDecimal spent, BigDecimal amount) {
        if (amount.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return spent.multiply(HUNDRED).divide(amount, MathContext.DECIMAL128);
    }

    /**
     * Whole days from {@code now} to {@code end}, floored, never negative.
     */
    static int daysRemaining(LocalDateTime now, LocalDateTime end) {
        if (end == null) {
            return 0;
        }
        long days = Math.floorDiv(Duration.between(now, end).getSeconds(), SECONDS_PER_DAY);
        return (int) Math.max(0, Math.min(days, Integer.MAX_VALUE));
    }
}
