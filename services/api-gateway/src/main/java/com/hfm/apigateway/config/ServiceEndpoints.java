package com.hfm.apigateway.config;

import com.hfm.apigateway.routing.BackendService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Base URLs of the backend services, resolved from the environment once at startup.
 */
@Component
@Slf4j
public class ServiceEndpoints {

    private final Map<BackendService, URI> baseUrls;

    public ServiceEndpoints(
            @Value("${services.transactions.url}") String transactionServiceUrl,
            @Value("${services.accounts.url}") String accountServiceUrl,
            @Value("${services.notifications.url}") String notificationServiceUrl,
            @Value("${services.budget.url}") String budgetServiceUrl) {
        Map<BackendService, URI> urls = new EnumMap<>(BackendService.class);
        urls.put(BackendService.TRANSACTIONS, URI.create(transactionServiceUrl));
        urls.put(BackendService.ACCOUNTS, URI.create(accountServiceUrl));
        urls.put(BackendService.NOTIFICATIONS, URI.create(notificationServiceUrl));
        urls.put(BackendService.BUDGET, URI.create(budgetServiceUrl));
        this.baseUrls = Collections.unmodifiableMap(urls);
        urls.forEach((service, url) -> log.info("Backend {} -> {}", service.getServiceName(), url));
    }

    public URI uriFor(BackendService service) {
        return baseUrls.get(service);
    }
}
