package com.hfm.budget.service;

import com.hfm.budget.client.TransactionFetchResult;
import com.hfm.budget.client.TransactionSource;
import com.hfm.budget.config.BudgetAnalysisProperties;
import com.hfm.budget.domain.Budget;
import com.hfm.budget.dto.BudgetAnalysis;
import com.hfm.budget.dto.SpendingInsight;
import com.hfm.budget.engine.BudgetAnalysisEngine;
import com.hfm.budget.exception.UpstreamUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Fetches transactions for budgets and insight windows and hands them to the
 * {@link BudgetAnalysisEngine}.
 */
@Service
@Slf4j
public class BudgetAnalysisService {

    static final String TRANSACTION_SERVICE = "transaction-service";

    private final TransactionSource transactionSource;
    private final BudgetAnalysisProperties properties;
    private final Clock clock;
    private final BudgetAnalysisEngine engine = new BudgetAnalysisEngine();

    public BudgetAnalysisService(TransactionSource transactionSource,
                                 BudgetAnalysisProperties properties,
                                 Clock clock) {
        this.transactionSource = transactionSource;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Analyzes each budget over its own window. Fetches run concurrently; results come back in the
     * order of {@code budgets}. A budget whose fetch fails, or is still pending when the request
     * timeout runs out, is reported with an upstream error and does not affect the others.
     */
    public List<BudgetAnalysis> analyze(Long userId, List<Budget> budgets) {
        if (budgets.isEmpty()) {
            return List.of();
        }
        LocalDateTime now = LocalDateTime.now(clock);
        long deadlineNanos = System.nanoTime() + properties.getRequestTimeout().toNanos();
        log.debug("Analyzing {} budgets for user {}", budgets.size(), userId);

        // every element is bounded by the deadline, so the list always completes
        return Flux.fromIterable(budgets)
                .flatMapSequential(budget -> analyzeOne(userId, budget, now, deadlineNanos),
                        properties.getMaxConcurrentFetches())
                .collectList()
                .block();
    }

    /**
     * Per-category spending over the last {@code windowDays} days.
     *
     * @throws IllegalArgumentException if {@code windowDays} is below 1
     * @throws UpstreamUnavailableException if the transactions could not be fetched
     */
    public List<SpendingInsight> spendingInsights(Long userId, int windowDays) {
        if (windowDays < 1) {
            throw new IllegalArgumentException("days must be at least 1, got " + windowDays);
        }
        LocalDateTime end = LocalDateTime.now(clock);
        LocalDateTime start = end.minusDays(windowDays);

        TransactionFetchResult result = fetch(userId, start, end)
                .timeout(properties.getRequestTimeout(), Mono.fromSupplier(() -> timedOut(userId)))
                .block();
        if (result == null || !result.isAvailable()) {
            String reason = result != null ? result.describeFailure() : "no response from " + TRANSACTION_SERVICE;
            throw new UpstreamUnavailableException(TRANSACTION_SERVICE, reason);
        }
        return engine.summarizeByCategory(result.getTransactions());
    }

    private Mono<BudgetAnalysis> analyzeOne(Long userId, Budget budget, LocalDateTime now, long deadlineNanos) {
        return Mono.defer(() -> {
            long remainingNanos = deadlineNanos - System.nanoTime();
            if (remainingNanos <= 0) {
                return Mono.just(timedOut(userId));
            }
            return fetch(userId, budget.getStartDate(), budget.getEndDate())
                    .timeout(Duration.ofNanos(remainingNanos), Mono.fromSupplier(() -> timedOut(userId)));
        }).map(result -> toAnalysis(budget, result, now));
    }

    private TransactionFetchResult timedOut(Long userId) {
        log.warn("Transaction fetch for user {} did not finish within {}", userId, properties.getRequestTimeout());
        return TransactionFetchResult.unavailable("timed out");
    }

    private BudgetAnalysis toAnalysis(Budget budget, TransactionFetchResult result, LocalDateTime now) {
        switch (result.getOutcome()) {
            case AVAILABLE:
                return engine.analyze(budget, result.getTransactions(), now);
            case REJECTED:
                if (properties.isTreatRejectedAsEmpty()) {
                    log.debug("Budget {} analyzed without transactions: {}", budget.getId(), result.describeFailure());
                    return engine.analyze(budget, List.of(), now);
                }
                return engine.failed(budget, result.describeFailure());
            default:
                return engine.failed(budget, result.describeFailure());
        }
    }

    private Mono<TransactionFetchResult> fetch(Long userId, LocalDateTime start, LocalDateTime end) {
        return transactionSource.fetchTransactions(userId, start, end)
                .onErrorResume(error -> {
                    log.warn("Transaction source failed for user {}: {}", userId, error.toString());
                    return Mono.just(TransactionFetchResult.unavailable(String.valueOf(error.getMessage())));
                })
                .defaultIfEmpty(TransactionFetchResult.unavailable("empty response"));
    }
}
