package com.hfm.apigateway.routing;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Static inbound-path to backend table. Built once at startup and read-only afterwards; the same
 * rules feed the gateway {@code RouteLocator} and {@link #resolve(String)}.
 *
 * <p>Rules are evaluated in declaration order, so the auth aliases shadow the generic prefixes.
 */
public class GatewayRouteTable {

    public static final String API_PREFIX = "/api/v1";

    private final List<GatewayRoute> routes;
    private final List<Pattern> patterns;

    public GatewayRouteTable(List<GatewayRoute> routes) {
        this.routes = List.copyOf(routes);
        this.patterns = this.routes.stream().map(GatewayRoute::compiledRewrite).toList();
    }

    public static GatewayRouteTable standard() {
        return new GatewayRouteTable(List.of(
                GatewayRoute.alias("auth-register", API_PREFIX + "/auth/register", BackendService.ACCOUNTS, "/users/register"),
                GatewayRoute.alias("auth-login", API_PREFIX + "/auth/login", BackendService.ACCOUNTS, "/users/login"),
                GatewayRoute.alias("auth-me", API_PREFIX + "/auth/me", BackendService.ACCOUNTS, "/users/me"),
                GatewayRoute.prefix("transactions", API_PREFIX + "/transactions", BackendService.TRANSACTIONS, ""),
                GatewayRoute.prefix("users", API_PREFIX + "/users", BackendService.ACCOUNTS, "/users"),
                GatewayRoute.prefix("accounts", API_PREFIX + "/accounts", BackendService.ACCOUNTS, "/accounts"),
                GatewayRoute.prefix("notifications", API_PREFIX + "/notifications", BackendService.NOTIFICATIONS, "/notifications"),
                GatewayRoute.prefix("preferences", API_PREFIX + "/preferences", BackendService.NOTIFICATIONS, "/preferences"),
                GatewayRoute.prefix("budgets", API_PREFIX + "/budgets", BackendService.BUDGET, "/budgets"),
                GatewayRoute.prefix("insights", API_PREFIX + "/insights", BackendService.BUDGET, "/insights")
        ));
    }

    public List<GatewayRoute> getRoutes() {
        return routes;
    }

    public Optional<RouteTarget> resolve(String path) {
        if (path == null) {
            return Optional.empty();
        }
        for (int i = 0; i < routes.size(); i++) {
            Matcher matcher = patterns.get(i).matcher(path);
            if (matcher.matches()) {
                return Optional.of(new RouteTarget(routes.get(i), matcher.replaceAll(routes.get(i).getReplacement())));
            }
        }
        return Optional.empty();
    }
}
