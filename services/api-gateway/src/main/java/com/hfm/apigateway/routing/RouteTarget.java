package com.hfm.apigateway.routing;

import lombok.Value;

/**
 * Result of resolving an inbound path: the matching route and the path sent to its backend.
 */
@Value
public class RouteTarget {
    GatewayRoute route;
    String path;

    public BackendService getService() {
        return route.getService();
    }
}
