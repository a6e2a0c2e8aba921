package com.hfm.apigateway.error;

import com.hfm.apigateway.config.RouteConfig;
import org.springframework.cloud.gateway.route.Route;
import org.springframework.cloud.gateway.support.ServerWebExchangeUtils;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.netty.http.client.PrematureCloseException;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies errors raised while proxying. A transport failure is anything that kept the backend
 * from answering: refused or timed-out connections, DNS failures, response timeouts and connections
 * closed before a response arrived.
 */
public final class UpstreamFailures {

    private static final int MAX_CAUSE_DEPTH = 16;

    private UpstreamFailures() {
    }

    public static boolean isTransportFailure(Throwable ex) {
        return findTransportFailure(ex) != null;
    }

    /**
     * Text of the underlying transport error, suitable for returning to the caller.
     */
    public static String describe(Throwable ex) {
        Throwable failure = findTransportFailure(ex);
        Throwable source = failure != null ? failure : ex;
        if (source instanceof ResponseStatusException) {
            String reason = ((ResponseStatusException) source).getReason();
            if (reason != null) {
                return reason;
            }
        }
        String message = source.getMessage();
        if (message == null && source.getCause() != null) {
            message = source.getCause().getMessage();
        }
        return message != null ? message : source.getClass().getSimpleName();
    }

    /**
     * Name of the backend the matched route targets, or {@code null} before routing.
     */
    public static String targetService(ServerWebExchange exchange) {
        Route route = exchange.getAttribute(ServerWebExchangeUtils.GATEWAY_ROUTE_ATTR);
        if (route == null) {
            return null;
        }
        Object service = route.getMetadata().get(RouteConfig.SERVICE_METADATA_KEY);
        return service != null ? service.toString() : route.getId();
    }

    private static Throwable findTransportFailure(Throwable ex) {
        Throwable current = ex;
        int depth = 0;
        while (current != null && depth++ < MAX_CAUSE_DEPTH) {
            if (current instanceof ConnectException
                    || current instanceof UnknownHostException
                    || current instanceof TimeoutException
                    || current instanceof io.netty.handler.timeout.TimeoutException
                    || current instanceof PrematureCloseException) {
                return current;
            }
            if (current instanceof ResponseStatusException
                    && ((ResponseStatusException) current).getStatusCode().value() == HttpStatus.GATEWAY_TIMEOUT.value()) {
                return current;
            }
            current = current.getCause();
        }
        return null;
    }
}
