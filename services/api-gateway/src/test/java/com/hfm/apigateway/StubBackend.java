package com.hfm.apigateway;

import io.netty.handler.codec.http.HttpHeaderNames;
import lombok.Value;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Minimal backend on an ephemeral port that answers every request with a canned response and
 * records what it received.
 */
final class StubBackend {

    private static final String HOST = "127.0.0.1";

    private final List<ReceivedRequest> received = new CopyOnWriteArrayList<>();
    private final DisposableServer server;

    private StubBackend(int status, String contentType, byte[] body, String slowPathPrefix, Duration delay) {
        this.server = HttpServer.create()
                .host(HOST)
                .port(0)
                .handle((request, response) -> request.receive().aggregate().asByteArray()
                        .defaultIfEmpty(new byte[0])
                        .flatMap(requestBody -> {
                            Map<String, String> headers = new HashMap<>();
                            request.requestHeaders().forEach(h -> headers.put(h.getKey().toLowerCase(), h.getValue()));
                            received.add(new ReceivedRequest(request.method().name(), request.uri(), headers, requestBody));

                            Mono<Void> reply = response.status(status)
                                    .header(HttpHeaderNames.CONTENT_TYPE, contentType)
                                    .sendByteArray(Mono.just(body))
                                    .then();
                            if (slowPathPrefix != null && request.uri().startsWith(slowPathPrefix)) {
                                return Mono.delay(delay).then(reply);
                            }
                            return reply;
                        }))
                .bindNow();
    }

    static StubBackend respond(int status, String contentType, String body) {
        return new StubBackend(status, contentType, body.getBytes(StandardCharsets.UTF_8), null, Duration.ZERO);
    }

    static StubBackend respond(int status, String contentType, byte[] body) {
        return new StubBackend(status, contentType, body, null, Duration.ZERO);
    }

    static StubBackend respondSlowlyOn(String pathPrefix, Duration delay, int status, String contentType, String body) {
        return new StubBackend(status, contentType, body.getBytes(StandardCharsets.UTF_8), pathPrefix, delay);
    }

    /**
     * A port nothing listens on.
     */
    static int closedPort() {
        DisposableServer probe = HttpServer.create().host(HOST).port(0).bindNow();
        int port = probe.port();
        probe.disposeNow();
        return port;
    }

    static String urlFor(int port) {
        return "http://" + HOST + ":" + port;
    }

    String baseUrl() {
        return urlFor(server.port());
    }

    String hostHeader() {
        return HOST + ":" + server.port();
    }

    int callCount() {
        return received.size();
    }

    ReceivedRequest lastRequest() {
        return received.get(received.size() - 1);
    }

    void reset() {
        received.clear();
    }

    void stop() {
        server.disposeNow();
    }

    @Value
    static class ReceivedRequest {
        String method;
        String uri;
        Map<String, String> headers;
        byte[] body;

        String header(String name) {
            return headers.get(name.toLowerCase());
        }
    }
}
