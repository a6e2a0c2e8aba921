package com.hfm.apigateway.error;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("UpstreamFailures Tests")
class UpstreamFailuresTest {

    @Test
    @DisplayName("Connection refused is a transport failure")
    void shouldClassifyConnectException() {
        ConnectException refused = new ConnectException("Connection refused: localhost/127.0.0.1:8300");

        assertThat(UpstreamFailures.isTransportFailure(refused)).isTrue();
        assertThat(UpstreamFailures.describe(refused)).isEqualTo("Connection refused: localhost/127.0.0.1:8300");
    }

    @Test
    @DisplayName("Wrapped DNS failure is found through the cause chain")
    void shouldFindWrappedUnknownHost() {
        RuntimeException wrapped = new RuntimeException("routing failed",
                new UnknownHostException("Failed to resolve 'budget-analysis'"));

        assertThat(UpstreamFailures.isTransportFailure(wrapped)).isTrue();
        assertThat(UpstreamFailures.describe(wrapped)).isEqualTo("Failed to resolve 'budget-analysis'");
    }

    @Test
    @DisplayName("Response timeout surfaces as a transport failure with its reason")
    void shouldClassifyGatewayTimeout() {
        ResponseStatusException timeout = new ResponseStatusException(HttpStatus.GATEWAY_TIMEOUT,
                "Response took longer than timeout: PT10S", new TimeoutException());

        assertThat(UpstreamFailures.isTransportFailure(timeout)).isTrue();
        assertThat(UpstreamFailures.describe(timeout)).isEqualTo("Response took longer than timeout: PT10S");
    }

    @Test
    @DisplayName("Not found and generic errors are not transport failures")
    void shouldNotClassifyOtherErrors() {
        assertThat(UpstreamFailures.isTransportFailure(new ResponseStatusException(HttpStatus.NOT_FOUND))).isFalse();
        assertThat(UpstreamFailures.isTransportFailure(new IllegalStateException("boom"))).isFalse();
        assertThat(UpstreamFailures.isTransportFailure(new IOException("disk"))).isFalse();
    }

    @Test
    @DisplayName("Message falls back to the exception type")
    void shouldDescribeMessagelessException() {
        assertThat(UpstreamFailures.describe(new TimeoutException())).isEqualTo("TimeoutException");
    }

    @Test
    @DisplayName("No route means no target service")
    void shouldReturnNullServiceBeforeRouting() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/v1/users/1"));

        assertThat(UpstreamFailures.targetService(exchange)).isNull();
    }
}
