package com.hfm.budget.client;

import com.hfm.budget.dto.TransactionRecord;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of one transaction fetch. A rejected or unavailable fetch carries no transactions and
 * must not be read as an empty history.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransactionFetchResult {

    public enum Outcome {
        /** 2xx with a decodable body. */
        AVAILABLE,
        /** Non-2xx reply, or a body that could not be decoded. */
        REJECTED,
        /** No reply: connection refused, DNS failure or timeout. */
        UNAVAILABLE
    }

    Outcome outcome;
    List<TransactionRecord> transactions;
    Integer statusCode;
    String reason;

    public static TransactionFetchResult available(List<TransactionRecord> transactions) {
        List<TransactionRecord> records = transactions != null
                ? Collections.unmodifiableList(transactions)
                : Collections.emptyList();
        return new TransactionFetchResult(Outcome.AVAILABLE, records, null, null);
    }

    public static TransactionFetchResult rejected(Integer statusCode, String reason) {
        return new TransactionFetchResult(Outcome.REJECTED, Collections.emptyList(), statusCode, reason);
    }

    public static TransactionFetchResult unavailable(String reason) {
        return new TransactionFetchResult(Outcome.UNAVAILABLE, Collections.emptyList(), null, reason);
    }

    public boolean isAvailable() {
        return outcome == Outcome.AVAILABLE;
    }

    /**
     * Human-readable cause, including the upstream status when there was one.
     */
    public String describeFailure() {
        if (statusCode != null) {
            return "transaction-service responded " + statusCode + ": " + reason;
        }
        if (outcome == Outcome.REJECTED) {
            return "transaction-service rejected the request: " + reason;
        }
        return "transaction-service unavailable: " + reason;
    }
}
