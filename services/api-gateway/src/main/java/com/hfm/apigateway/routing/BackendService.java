package com.hfm.apigateway.routing;

/**
 * Backend services reachable through the gateway.
 */
public enum BackendService {

    TRANSACTIONS("transaction-service"),
    ACCOUNTS("account-service"),
    NOTIFICATIONS("notification-service"),
    BUDGET("budget-analysis-service");

    private final String serviceName;

    BackendService(String serviceName) {
        this.serviceName = serviceName;
    }

    public String getServiceName() {
        return serviceName;
    }
}
