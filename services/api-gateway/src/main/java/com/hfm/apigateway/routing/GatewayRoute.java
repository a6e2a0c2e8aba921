package com.hfm.apigateway.routing;

import lombok.Builder;
import lombok.Value;

import java.util.regex.Pattern;

/**
 * A single inbound path rule. {@code pathPattern} is the Spring path pattern used by the gateway
 * predicate; {@code rewriteRegex} and {@code replacement} rewrite the matched path into the path the
 * backend expects.
 */
@Value
@Builder
public class GatewayRoute {

    String id;
    String pathPattern;
    String rewriteRegex;
    String replacement;
    BackendService service;

    public Pattern compiledRewrite() {
        return Pattern.compile(rewriteRegex);
    }

    /**
     * Exact route: {@code inbound} always lands on {@code target}.
     */
    public static GatewayRoute alias(String id, String inbound, BackendService service, String target) {
        return GatewayRoute.builder()
                .id(id)
                .pathPattern(inbound)
                .rewriteRegex("^" + Pattern.quote(inbound) + "/?$")
                .replacement(target)
                .service(service)
                .build();
    }

    /**
     * Prefix route: {@code inboundPrefix/rest} lands on {@code targetPrefix/rest}. An empty
     * {@code targetPrefix} strips the inbound prefix entirely.
     */
    public static GatewayRoute prefix(String id, String inboundPrefix, BackendService service, String targetPrefix) {
        String quoted = Pattern.quote(inboundPrefix);
        boolean stripAll = targetPrefix.isEmpty();
        return GatewayRoute.builder()
                .id(id)
                .pathPattern(inboundPrefix + "/**")
                .rewriteRegex(stripAll ? "^" + quoted + "(?:/(?<rest>.*))?$" : "^" + quoted + "(?<rest>/.*)?$")
                .replacement(stripAll ? "/${rest}" : targetPrefix + "${rest}")
                .service(service)
                .build();
    }
}
