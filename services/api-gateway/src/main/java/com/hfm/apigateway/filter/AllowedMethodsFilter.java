package com.hfm.apigateway.filter;

import com.hfm.apigateway.error.ErrorResponseWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Rejects methods outside GET/POST/PUT/DELETE before routing, so no backend is ever contacted for
 * them.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
@Slf4j
public class AllowedMethodsFilter implements WebFilter {

    public static final Set<HttpMethod> ALLOWED_METHODS = Collections.unmodifiableSet(new LinkedHashSet<>(
            List.of(HttpMethod.GET, HttpMethod.POST, HttpMethod.PUT, HttpMethod.DELETE)));

    private final ErrorResponseWriter errorResponseWriter;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        HttpMethod method = request.getMethod();
        if (ALLOWED_METHODS.contains(method)) {
            return chain.filter(exchange);
        }

        log.warn("Rejected {} {}: method not allowed", method, request.getURI().getPath());
        exchange.getResponse().getHeaders().setAllow(ALLOWED_METHODS);
        return errorResponseWriter.write(exchange, HttpStatus.METHOD_NOT_ALLOWED,
                "Method " + method.name() + " is not allowed", null);
    }
}
