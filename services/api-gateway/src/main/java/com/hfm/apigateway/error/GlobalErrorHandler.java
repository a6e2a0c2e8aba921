package com.hfm.apigateway.error;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.reactive.error.ErrorWebExceptionHandler;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Translates proxying errors. Transport failures become 503 carrying the underlying error text;
 * status exceptions keep their status; everything else is a 500. Backend error responses never
 * reach this handler, they are relayed as-is.
 */
@Component
@Order(-2) // ahead of Spring Boot's default handler
@Slf4j
@RequiredArgsConstructor
public class GlobalErrorHandler implements ErrorWebExceptionHandler {

    private final ErrorResponseWriter errorResponseWriter;

    @Override
    public Mono<Void> handle(ServerWebExchange exchange, Throwable ex) {
        if (exchange.getResponse().isCommitted()) {
            return Mono.error(ex);
        }

        ServerHttpRequest request = exchange.getRequest();
        String service = UpstreamFailures.targetService(exchange);

        if (UpstreamFailures.isTransportFailure(ex)) {
            String cause = UpstreamFailures.describe(ex);
            log.warn("Backend {} unavailable for {} {}: {}", service, request.getMethod(),
                    request.getURI().getPath(), cause);
            return errorResponseWriter.write(exchange, HttpStatus.SERVICE_UNAVAILABLE, cause, service);
        }

        HttpStatus status;
        String message;
        if (ex instanceof ResponseStatusException) {
            ResponseStatusException statusException = (ResponseStatusException) ex;
            HttpStatus resolved = HttpStatus.resolve(statusException.getStatusCode().value());
            status = resolved != null ? resolved : HttpStatus.INTERNAL_SERVER_ERROR;
            message = statusException.getReason() != null ? statusException.getReason() : status.getReasonPhrase();
            log.debug("Gateway status {} for {} {}", status.value(), request.getMethod(), request.getURI().getPath());
        } else {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
            message = "Internal Server Error";
            log.error("Gateway Error: {}", ex.getMessage(), ex);
        }
        return errorResponseWriter.write(exchange, status, message, service);
    }
}
