package com.hfm.apigateway;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuple2;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@DisplayName("Gateway routing integration")
class GatewayRoutingIntegrationTest {

    private static final String TOKEN_JSON = "{\"access_token\":\"abc\",\"token_type\":\"bearer\"}";
    private static final byte[] CSV_BYTES = "amount,category\r\n120,Dining\r\n80,café\r\n".getBytes(StandardCharsets.UTF_8);

    private static final StubBackend accounts = StubBackend.respond(200, "application/json", TOKEN_JSON);
    private static final StubBackend transactions = StubBackend.respond(200, "text/csv", CSV_BYTES);
    private static final StubBackend budget = StubBackend.respondSlowlyOn("/budgets/slow", Duration.ofSeconds(3),
            404, "application/json", "{\"detail\":\"Budget not found\"}");
    private static final int notificationsPort = StubBackend.closedPort();

    @DynamicPropertySource
    static void backendUrls(DynamicPropertyRegistry registry) {
        registry.add("services.accounts.url", accounts::baseUrl);
        registry.add("services.transactions.url", transactions::baseUrl);
        registry.add("services.budget.url", budget::baseUrl);
        registry.add("services.notifications.url", () -> StubBackend.urlFor(notificationsPort));
        registry.add("spring.cloud.gateway.httpclient.response-timeout", () -> "1s");
    }

    @AfterAll
    static void stopBackends() {
        accounts.stop();
        transactions.stop();
        budget.stop();
    }

    @Autowired
    private WebTestClient webTestClient;

    @LocalServerPort
    private int port;

    @BeforeEach
    void resetBackends() {
        accounts.reset();
        transactions.reset();
        budget.reset();
    }

    @Nested
    @DisplayName("Forwarding")
    class Forwarding {

        @Test
        @DisplayName("Login is forwarded to /users/login with the same body bytes and without the inbound Host")
        void shouldForwardLoginToAccounts() {
            byte[] credentials = "{\"username\": \"ana\",  \"password\": \"s3cret\"}".getBytes(StandardCharsets.UTF_8);

            webTestClient.post().uri("/api/v1/auth/login")
                    .header(HttpHeaders.HOST, "client.example")
                    .header("X-Client-Version", "2.4.1")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(credentials)
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody().json(TOKEN_JSON);

            assertThat(accounts.callCount()).isEqualTo(1);
            StubBackend.ReceivedRequest received = accounts.lastRequest();
            assertThat(received.getMethod()).isEqualTo("POST");
            assertThat(received.getUri()).isEqualTo("/users/login");
            assertThat(received.getBody()).isEqualTo(credentials);
            assertThat(received.header("Host")).isEqualTo(accounts.hostHeader());
            assertThat(received.header("X-Client-Version")).isEqualTo("2.4.1");
        }

        @Test
        @DisplayName("Register alias lands on /users/register")
        void shouldForwardRegisterAlias() {
            webTestClient.post().uri("/api/v1/auth/register")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"email\":\"ana@example.com\"}")
                    .exchange()
                    .expectStatus().isOk();

            assertThat(accounts.lastRequest().getUri()).isEqualTo("/users/register");
        }

        @Test
        @DisplayName("Transactions prefix is stripped and the query string kept")
        void shouldStripTransactionsPrefixAndKeepQuery() {
            webTestClient.get().uri("/api/v1/transactions/transactions/7?start_date=2024-01-01T00:00:00")
                    .exchange()
                    .expectStatus().isOk();

            assertThat(transactions.lastRequest().getUri())
                    .isEqualTo("/transactions/7?start_date=2024-01-01T00:00:00");
            assertThat(transactions.lastRequest().getMethod()).isEqualTo("GET");
        }

        @Test
        @DisplayName("Non-JSON payloads are relayed byte for byte")
        void shouldRelayNonJsonVerbatim() {
            webTestClient.get().uri("/api/v1/transactions/export")
                    .exchange()
                    .expectStatus().isOk()
                    .expectHeader().contentType("text/csv")
                    .expectBody(byte[].class).isEqualTo(CSV_BYTES);
        }

        @Test
        @DisplayName("DELETE goes out without a body")
        void shouldDropBodyOnDelete() {
            webTestClient.method(HttpMethod.DELETE).uri("/api/v1/accounts/3")
                    .contentType(MediaType.TEXT_PLAIN)
                    .bodyValue("should not be forwarded")
                    .exchange()
                    .expectStatus().isOk();

            StubBackend.ReceivedRequest received = accounts.lastRequest();
            assertThat(received.getMethod()).isEqualTo("DELETE");
            assertThat(received.getUri()).isEqualTo("/accounts/3");
            assertThat(received.getBody()).isEmpty();
        }

        @Test
        @DisplayName("PUT body is forwarded unmodified whatever its content type")
        void shouldForwardPutBody() {
            byte[] form = "email_enabled=true&sms_enabled=false".getBytes(StandardCharsets.UTF_8);

            webTestClient.put().uri("/api/v1/users/7")
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .bodyValue(form)
                    .exchange()
                    .expectStatus().isOk();

            assertThat(accounts.lastRequest().getUri()).isEqualTo("/users/7");
            assertThat(accounts.lastRequest().getBody()).isEqualTo(form);
        }

        @Test
        @DisplayName("Backend error status and body are relayed unchanged")
        void shouldRelayBackendNotFound() {
            webTestClient.get().uri("/api/v1/budgets/99")
                    .exchange()
                    .expectStatus().isNotFound()
                    .expectBody().json("{\"detail\":\"Budget not found\"}");

            assertThat(budget.lastRequest().getUri()).isEqualTo("/budgets/99");
        }
    }

    @Nested
    @DisplayName("Rejections and failures")
    class Failures {

        @Test
        @DisplayName("PATCH is rejected without contacting any backend")
        void shouldRejectPatchLocally() {
            webTestClient.patch().uri("/api/v1/users/1")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"name\":\"x\"}")
                    .exchange()
                    .expectStatus().isEqualTo(HttpStatus.METHOD_NOT_ALLOWED)
                    .expectHeader().valueMatches(HttpHeaders.ALLOW, ".*GET.*")
                    .expectBody()
                    .jsonPath("$.status").isEqualTo(405)
                    .jsonPath("$.message").isEqualTo("Method PATCH is not allowed");

            assertThat(accounts.callCount()).isZero();
        }

        @Test
        @DisplayName("Unreachable backend yields 503 with the underlying error")
        void shouldReturnServiceUnavailableForUnreachableBackend() {
            webTestClient.get().uri("/api/v1/notifications/5")
                    .exchange()
                    .expectStatus().isEqualTo(HttpStatus.SERVICE_UNAVAILABLE)
                    .expectBody()
                    .jsonPath("$.status").isEqualTo(503)
                    .jsonPath("$.service").isEqualTo("notification-service")
                    .jsonPath("$.message").value(message -> assertThat((String) message).isNotBlank())
                    .jsonPath("$.path").isEqualTo("/api/v1/notifications/5");
        }

        @Test
        @DisplayName("Slow backend is cut off by the response timeout")
        void shouldReturnServiceUnavailableOnTimeout() {
            webTestClient.get().uri("/api/v1/budgets/slow")
                    .exchange()
                    .expectStatus().isEqualTo(HttpStatus.SERVICE_UNAVAILABLE)
                    .expectBody()
                    .jsonPath("$.service").isEqualTo("budget-analysis-service")
                    .jsonPath("$.message").value(message -> assertThat((String) message).contains("timeout"));
        }

        @Test
        @DisplayName("An unavailable backend does not affect concurrent requests to a healthy one")
        void shouldIsolateConcurrentRequests() {
            WebClient client = WebClient.create("http://localhost:" + port);

            Mono<ResponseEntity<String>> unavailable = client.get().uri("/api/v1/preferences/5")
                    .exchangeToMono(response -> response.toEntity(String.class));
            Mono<ResponseEntity<String>> healthy = client.get().uri("/api/v1/users/me")
                    .exchangeToMono(response -> response.toEntity(String.class));

            Tuple2<ResponseEntity<String>, ResponseEntity<String>> results =
                    Mono.zip(unavailable, healthy).block(Duration.ofSeconds(10));

            assertThat(results).isNotNull();
            assertThat(results.getT1().getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
            assertThat(results.getT2().getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(results.getT2().getBody()).contains("access_token");
        }

        @Test
        @DisplayName("Unrouted path is a 404 from the gateway")
        void shouldReturnNotFoundForUnroutedPath() {
            webTestClient.get().uri("/api/v1/wallets/1")
                    .exchange()
                    .expectStatus().isNotFound();

            assertThat(accounts.callCount() + transactions.callCount() + budget.callCount()).isZero();
        }
    }

    @Test
    @DisplayName("Health is answered by the gateway itself")
    void shouldAnswerHealthLocally() {
        webTestClient.get().uri("/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody().json("{\"status\":\"healthy\"}");

        assertThat(accounts.callCount() + transactions.callCount() + budget.callCount()).isZero();
    }

    @Test
    @DisplayName("Route table is published")
    void shouldListRoutes() {
        webTestClient.get().uri("/routes")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.totalRoutes").isEqualTo(10)
                .jsonPath("$.routes[0].id").isEqualTo("auth-register")
                .jsonPath("$.routes[0].target").isEqualTo(accounts.baseUrl());
    }
}
