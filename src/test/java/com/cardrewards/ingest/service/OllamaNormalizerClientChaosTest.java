package com.cardrewards.ingest.service;

import com.cardrewards.ingest.config.IngestProperties;
import com.cardrewards.ingest.domain.ChatRequest;
import com.cardrewards.ingest.exception.NormalizationException;
import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.nio.file.Path;
import java.time.Duration;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("OllamaNormalizerClient Chaos Testing")
class OllamaNormalizerClientChaosTest {

    @RegisterExtension
    static WireMockExtension wireMock = WireMockExtension.newInstance()
            .options(wireMockConfig().dynamicPort())
            .build();

    private static final String CHAT_ENDPOINT = "/api/chat";

    private static final String CANONICAL_CSV =
            "transaction_date,description,amount,category,card\\n2024-03-01,STARBUCKS,4.50,Dining,amex";

    @Test
    @DisplayName("Should send a single-turn prompt and return the message content verbatim")
    void shouldReturnMessageContent() {
        // Given
        wireMock.stubFor(post(urlEqualTo(CHAT_ENDPOINT))
                .willReturn(okJson(chatBody(CANONICAL_CSV))));

        OllamaNormalizerClient client = createClient(1, 2_000);

        // When
        String normalized = client.normalize("Date,Payee,Debit\n03/01/2024,Starbucks,$4.50", "amex");

        // Then
        assertThat(normalized)
                .startsWith("transaction_date,description,amount,category,card")
                .contains("2024-03-01,STARBUCKS,4.50,Dining,amex");
        wireMock.verify(exactly(1), postRequestedFor(urlEqualTo(CHAT_ENDPOINT))
                .withRequestBody(matchingJsonPath("$.model", equalTo("llama3")))
                .withRequestBody(matchingJsonPath("$.stream", equalTo("false")))
                .withRequestBody(matchingJsonPath("$.messages[0].role", equalTo("user")))
                .withRequestBody(matchingJsonPath("$.messages[0].content", containing("Card must be set to: amex")))
                .withRequestBody(matchingJsonPath("$.messages[0].content", containing("03/01/2024,Starbucks,$4.50"))));
    }

    @Test
    @DisplayName("Chaos: Should retry on 500 errors and eventually succeed")
    void shouldRetryOn500ErrorsAndSucceed() {
        // Given - First attempt fails, second succeeds
        wireMock.stubFor(post(urlEqualTo(CHAT_ENDPOINT))
                .inScenario("Retry Scenario")
                .whenScenarioStateIs("Started")
                .willReturn(aResponse()
                        .withStatus(500)
                        .withBody("model loading"))
                .willSetStateTo("Recovered"));

        wireMock.stubFor(post(urlEqualTo(CHAT_ENDPOINT))
                .inScenario("Retry Scenario")
                .whenScenarioStateIs("Recovered")
                .willReturn(okJson(chatBody(CANONICAL_CSV))));

        OllamaNormalizerClient client = createClient(3, 2_000);

        // When/Then
        StepVerifier.create(client.chat(ChatRequest.singleTurn("llama3", "normalize")))
                .assertNext(content -> assertThat(content).startsWith("transaction_date"))
                .verifyComplete();

        wireMock.verify(exactly(2), postRequestedFor(urlEqualTo(CHAT_ENDPOINT)));
    }

    @Test
    @DisplayName("Chaos: Should surface 5xx as NormalizationException with status code")
    void shouldSurfaceServerErrors() {
        wireMock.stubFor(post(urlEqualTo(CHAT_ENDPOINT))
                .willReturn(aResponse()
                        .withStatus(503)
                        .withBody("overloaded")));

        OllamaNormalizerClient client = createClient(1, 2_000);

        assertThatThrownBy(() -> client.normalize("raw", "amex"))
                .isInstanceOf(NormalizationException.class)
                .hasMessageContaining("overloaded")
                .extracting(ex -> ((NormalizationException) ex).getStatusCode())
                .isEqualTo(503);
    }

    @Test
    @DisplayName("Chaos: Should treat a slow model as a normalization failure")
    void shouldTimeOutSlowModel() {
        wireMock.stubFor(post(urlEqualTo(CHAT_ENDPOINT))
                .willReturn(okJson(chatBody(CANONICAL_CSV))
                        .withFixedDelay(1_500)));

        OllamaNormalizerClient client = createClient(1, 300);

        assertThatThrownBy(() -> client.normalize("raw", "amex"))
                .isInstanceOf(NormalizationException.class)
                .hasMessageContaining("timed out after 300 ms");
    }

    @Test
    @DisplayName("Chaos: Should reject an empty model reply")
    void shouldRejectEmptyReply() {
        wireMock.stubFor(post(urlEqualTo(CHAT_ENDPOINT))
                .willReturn(okJson(chatBody(""))));

        OllamaNormalizerClient client = createClient(1, 2_000);

        assertThatThrownBy(() -> client.normalize("raw", "amex"))
                .isInstanceOf(NormalizationException.class)
                .hasMessageContaining("empty response");
    }

    @Test
    @DisplayName("Chaos: Should open circuit breaker after repeated failures")
    void shouldOpenCircuitBreakerAfterRepeatedFailures() {
        // Given - All requests fail
        wireMock.stubFor(post(urlEqualTo(CHAT_ENDPOINT))
                .willReturn(aResponse()
                        .withStatus(500)
                        .withBody("Internal Server Error")));

        CircuitBreaker circuitBreaker = CircuitBreakerRegistry.of(CircuitBreakerConfig.custom()
                        .slidingWindowSize(4)
                        .minimumNumberOfCalls(4)
                        .failureRateThreshold(50)
                        .waitDurationInOpenState(Duration.ofSeconds(30))
                        .build())
                .circuitBreaker("normalizer");
        OllamaNormalizerClient client = createClient(circuitBreaker, retry(1), 2_000);

        // When - Make enough failing calls to trip the breaker
        for (int i = 0; i < 4; i++) {
            assertThatThrownBy(() -> client.normalize("raw", "amex"))
                    .isInstanceOf(NormalizationException.class);
        }

        // Then - further calls are rejected without reaching the model
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThatThrownBy(() -> client.normalize("raw", "amex"))
                .isInstanceOf(NormalizationException.class)
                .hasMessageContaining("circuit breaker is open");
        wireMock.verify(exactly(4), postRequestedFor(urlEqualTo(CHAT_ENDPOINT)));
    }

    private OllamaNormalizerClient createClient(int maxAttempts, int requestTimeoutMs) {
        CircuitBreaker circuitBreaker = CircuitBreakerRegistry.ofDefaults().circuitBreaker("normalizer");
        return createClient(circuitBreaker, retry(maxAttempts), requestTimeoutMs);
    }

    private OllamaNormalizerClient createClient(CircuitBreaker circuitBreaker, Retry retry, int requestTimeoutMs) {
        WebClient webClient = WebClient.builder()
                .baseUrl("http://localhost:" + wireMock.getPort())
                .build();

        IngestProperties properties = new IngestProperties(
                Path.of("Incoming"),
                Path.of("Processed"),
                Path.of("Failed"),
                Path.of("watcher_log.csv"),
                30_000L,
                "household",
                new IngestProperties.Normalizer(
                        wireMock.baseUrl(), CHAT_ENDPOINT, "llama3", 1_000, requestTimeoutMs)
        );

        return new OllamaNormalizerClient(webClient, circuitBreaker, retry, properties);
    }

    private static Retry retry(int maxAttempts) {
        return RetryRegistry.of(RetryConfig.custom()
                        .maxAttempts(maxAttempts)
                        .waitDuration(Duration.ofMillis(50))
                        .build())
                .retry("normalizer");
    }

    private static String chatBody(String content) {
        return """
                {
                    "model": "llama3",
                    "created_at": "2024-03-10T12:00:00Z",
                    "message": {"role": "assistant", "content": "%s"},
                    "done": true
                }
                """.formatted(content);
    }
}
