package com.hfm.apigateway.config;

import com.hfm.apigateway.filter.ForwardingRequestFilter;
import com.hfm.apigateway.filter.JsonResponseRewriter;
import com.hfm.apigateway.routing.GatewayRoute;
import com.hfm.apigateway.routing.GatewayRouteTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cloud.gateway.route.RouteLocator;
import org.springframework.cloud.gateway.route.builder.RouteLocatorBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Turns the {@link GatewayRouteTable} into gateway routes. Each route rewrites the inbound path,
 * applies the forwarding rules and normalizes JSON responses.
 */
@Configuration
@Slf4j
public class RouteConfig {

    public static final String SERVICE_METADATA_KEY = "service";

    @Bean
    public GatewayRouteTable gatewayRouteTable() {
        return GatewayRouteTable.standard();
    }

    @Bean
    public RouteLocator hfmRouteLocator(RouteLocatorBuilder builder,
                                        GatewayRouteTable routeTable,
                                        ServiceEndpoints endpoints,
                                        ForwardingRequestFilter forwardingRequestFilter,
                                        JsonResponseRewriter jsonResponseRewriter) {
        RouteLocatorBuilder.Builder routes = builder.routes();
        for (GatewayRoute route : routeTable.getRoutes()) {
            String targetUrl = endpoints.uriFor(route.getService()).toString();
            log.info("Route {}: {} -> {}", route.getId(), route.getPathPattern(), targetUrl);
            routes.route(route.getId(), r -> r
                    .path(route.getPathPattern())
                    .filters(f -> f
                            .rewritePath(route.getRewriteRegex(), route.getReplacement())
                            .filter(forwardingRequestFilter)
                            .modifyResponseBody(byte[].class, byte[].class, jsonResponseRewriter))
                    .metadata(SERVICE_METADATA_KEY, route.getService().getServiceName())
                    .uri(targetUrl));
        }
        return routes.build();
    }
}
