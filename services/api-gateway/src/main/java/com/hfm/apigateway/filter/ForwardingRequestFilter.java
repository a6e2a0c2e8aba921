package com.hfm.apigateway.filter;

import org.springframework.cloud.gateway.filter.GatewayFilter;
import org.springframework.cloud.gateway.filter.GatewayFilterChain;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.server.reactive.ServerHttpRequestDecorator;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Set;

/**
 * Shapes the request handed to the backend: the inbound {@code Host} header is dropped so it cannot
 * clash with the target's own host, and GET/DELETE go out without a body. POST/PUT bodies pass
 * through untouched, whatever their content type.
 */
@Component
public class ForwardingRequestFilter implements GatewayFilter {

    static final Set<HttpMethod> BODYLESS_METHODS = Set.of(HttpMethod.GET, HttpMethod.DELETE);

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, GatewayFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        boolean bodyless = BODYLESS_METHODS.contains(request.getMethod());

        HttpHeaders headers = new HttpHeaders();
        headers.putAll(request.getHeaders());
        headers.remove(HttpHeaders.HOST);
        if (bodyless) {
            headers.remove(HttpHeaders.CONTENT_LENGTH);
            headers.remove(HttpHeaders.TRANSFER_ENCODING);
        }
        HttpHeaders forwardedHeaders = HttpHeaders.readOnlyHttpHeaders(headers);

        ServerHttpRequest forwarded = new ServerHttpRequestDecorator(request) {
            @Override
            public HttpHeaders getHeaders() {
                return forwardedHeaders;
            }

            @Override
            public Flux<DataBuffer> getBody() {
                return bodyless ? Flux.empty() : super.getBody();
            }
        };
        return chain.filter(exchange.mutate().request(forwarded).build());
    }
}
