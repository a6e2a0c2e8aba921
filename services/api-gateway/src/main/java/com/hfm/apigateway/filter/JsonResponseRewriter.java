package com.hfm.apigateway.filter;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.extern.slf4j.Slf4j;
import org.reactivestreams.Publisher;
import org.springframework.cloud.gateway.filter.factory.rewrite.RewriteFunction;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.io.IOException;

/**
 * Relays backend response bodies. JSON payloads are parsed and re-emitted as JSON; anything else,
 * including JSON that does not parse, is relayed byte for byte.
 */
@Component
@Slf4j
public class JsonResponseRewriter implements RewriteFunction<byte[], byte[]> {

    private final ObjectMapper objectMapper;
    private final ObjectReader treeReader;

    public JsonResponseRewriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.treeReader = objectMapper.reader()
                .with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .with(JsonNodeFactory.withExactBigDecimals(true));
    }

    @Override
    public Publisher<byte[]> apply(ServerWebExchange exchange, byte[] body) {
        if (body == null || body.length == 0) {
            return Mono.empty();
        }
        if (!isJson(exchange.getResponse().getHeaders().getContentType())) {
            return Mono.just(body);
        }
        try {
            JsonNode tree = treeReader.readTree(body);
            return Mono.just(objectMapper.writeValueAsBytes(tree));
        } catch (IOException e) {
            log.debug("Backend declared JSON but body did not parse, relaying verbatim: {}", e.getMessage());
            return Mono.just(body);
        }
    }

    static boolean isJson(MediaType contentType) {
        if (contentType == null) {
            return false;
        }
        return MediaType.APPLICATION_JSON.isCompatibleWith(contentType)
                || contentType.getSubtype().endsWith("+json");
    }
}
