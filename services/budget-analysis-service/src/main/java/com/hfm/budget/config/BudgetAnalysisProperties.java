package com.hfm.budget.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "hfm.budget.analysis")
public class BudgetAnalysisProperties {

    /**
     * Analyze a budget as if it had no transactions when the transaction service answers with a
     * non-2xx status. When false the budget is reported with an upstream error instead.
     */
    private boolean treatRejectedAsEmpty = true;

    /**
     * Upper bound on transaction fetches in flight for one analysis request.
     */
    @Min(1)
    private int maxConcurrentFetches = 4;

    /**
     * Upper bound on waiting for a whole analysis or insights request.
     */
    private Duration requestTimeout = Duration.ofSeconds(30);
}
