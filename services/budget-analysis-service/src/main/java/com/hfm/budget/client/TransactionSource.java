package com.hfm.budget.client;

import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

/**
 * Source of a user's transactions within a time window.
 */
public interface TransactionSource {

    /**
     * Fetches the user's transactions between {@code start} and {@code end}. The returned
     * {@link Mono} always completes with a result; failures are reported through its outcome,
     * never as an error signal.
     */
    Mono<TransactionFetchResult> fetchTransactions(Long userId, LocalDateTime start, LocalDateTime end);
}
