package com.hfm.budget.client;

import com.hfm.budget.dto.TransactionRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.codec.CodecException;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * WebClient-backed {@link TransactionSource} calling
 * {@code GET /transactions/{userId}?start_date=&end_date=} on the transaction service.
 */
@Component
@Slf4j
public class TransactionServiceClient implements TransactionSource {

    private static final ParameterizedTypeReference<List<TransactionRecord>> TRANSACTION_LIST =
            new ParameterizedTypeReference<>() {};

    private final WebClient webClient;
    private final Duration timeout;

    public TransactionServiceClient(@Qualifier("transactionServiceWebClient") WebClient webClient,
                                    @Value("${transaction-service.timeout:10s}") Duration timeout) {
        this.webClient = webClient;
        this.timeout = timeout;
    }

    @Override
    public Mono<TransactionFetchResult> fetchTransactions(Long userId, LocalDateTime start, LocalDateTime end) {
        log.debug("Fetching transactions for user {} between {} and {}", userId, start, end);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/transactions/{userId}")
                        .queryParam("start_date", format(start))
                        .queryParam("end_date", format(end))
                        .build(userId))
                .exchangeToMono(response -> {
                    if (response.statusCode().is2xxSuccessful()) {
                        return response.bodyToMono(TRANSACTION_LIST)
                                .defaultIfEmpty(List.of())
                                .map(TransactionFetchResult::available);
                    }
                    int status = response.statusCode().value();
                    return response.releaseBody()
                            .thenReturn(TransactionFetchResult.rejected(status, "HTTP " + status));
                })
                .timeout(timeout)
                .onErrorResume(error -> Mono.just(toFailure(error)))
                .doOnNext(result -> {
                    if (result.isAvailable()) {
                        log.debug("Fetched {} transactions for user {}", result.getTransactions().size(), userId);
                    } else {
                        log.warn("Transaction fetch for user {} failed: {}", userId, result.describeFailure());
                    }
                });
    }

    static TransactionFetchResult toFailure(Throwable error) {
        if (error instanceof CodecException) {
            return TransactionFetchResult.rejected(null, "undecodable response body: " + error.getMessage());
        }
        if (error instanceof TimeoutException) {
            return TransactionFetchResult.unavailable("timed out");
        }
        if (error instanceof WebClientRequestException) {
            Throwable cause = error.getCause() != null ? error.getCause() : error;
            return TransactionFetchResult.unavailable(describe(cause));
        }
        return TransactionFetchResult.unavailable(describe(error));
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private static String format(LocalDateTime value) {
        return value != null ? value.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME) : null;
    }
}
