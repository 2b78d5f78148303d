package com.cardrewards.ingest.service;

import com.cardrewards.ingest.config.IngestProperties;
import com.cardrewards.ingest.domain.ChatRequest;
import com.cardrewards.ingest.domain.ChatResponse;
import com.cardrewards.ingest.exception.NormalizationException;
import com.cardrewards.ingest.prompt.NormalizationPrompt;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Normalizer backed by an Ollama-compatible chat endpoint.
 * Features:
 * - Single-turn, non-streaming chat request with the fixed normalization prompt
 * - Bounded timeout per attempt; a timeout is a normalization failure
 * - Retry and circuit breaker from the {@code normalizer} Resilience4j instance
 */
@Service
@Slf4j
public class OllamaNormalizerClient implements StatementNormalizer {

    private final WebClient webClient;
    private final CircuitBreaker circuitBreaker;
    private final Retry retry;
    private final IngestProperties.Normalizer settings;

    public OllamaNormalizerClient(WebClient normalizerWebClient,
                                  CircuitBreaker normalizerCircuitBreaker,
                                  Retry normalizerRetry,
                                  IngestProperties properties) {
        this.webClient = normalizerWebClient;
        this.circuitBreaker = normalizerCircuitBreaker;
        this.retry = normalizerRetry;
        this.settings = properties.normalizer();
    }

    @Override
    public String normalize(String rawCsv, String cardLabel) {
        log.info("Normalizing statement for card '{}' ({} chars) with model {}",
                cardLabel, rawCsv.length(), settings.model());
        ChatRequest request = ChatRequest.singleTurn(settings.model(), NormalizationPrompt.build(rawCsv, cardLabel));
        return chat(request).block();
    }

    /**
     * Sends one chat request and emits the assistant message text.
     *
     * @param request the chat payload
     * @return Mono with the response content, never empty
     */
    public Mono<String> chat(ChatRequest request) {
        long timeoutMs = settings.requestTimeoutMs();

        return webClient
                .post()
                .uri(settings.chatEndpoint())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .onStatus(HttpStatusCode::is4xxClientError, response ->
                        response.bodyToMono(String.class).defaultIfEmpty("").flatMap(body -> {
                            log.error("Normalizer 4xx error: status={}, body={}", response.statusCode(), body);
                            return Mono.error(new NormalizationException(
                                    "Client error from normalizer: " + body,
                                    response.statusCode().value()
                            ));
                        }))
                .onStatus(HttpStatusCode::is5xxServerError, response ->
                        response.bodyToMono(String.class).defaultIfEmpty("").flatMap(body -> {
                            log.error("Normalizer 5xx error: status={}, body={}", response.statusCode(), body);
                            return Mono.error(new NormalizationException(
                                    "Server error from normalizer: " + body,
                                    response.statusCode().value()
                            ));
                        }))
                .bodyToMono(ChatResponse.class)
                .flatMap(this::extractContent)
                .switchIfEmpty(Mono.error(new NormalizationException("Normalizer returned an empty response")))
                .timeout(Duration.ofMillis(timeoutMs))
                .doOnSuccess(content -> log.debug("Normalizer returned {} chars", content.length()))
                .transformDeferred(RetryOperator.of(retry))
                .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
                .onErrorMap(ex -> toNormalizationException(ex, timeoutMs));
    }

    private Mono<String> extractContent(ChatResponse response) {
        String content = response.content();
        if (content == null || content.isBlank()) {
            return Mono.error(new NormalizationException("Normalizer returned an empty response"));
        }
        return Mono.just(content);
    }

    private Throwable toNormalizationException(Throwable ex, long timeoutMs) {
        if (ex instanceof NormalizationException) {
            return ex;
        }
        if (ex instanceof TimeoutException) {
            return new NormalizationException("Normalizer timed out after " + timeoutMs + " ms", ex);
        }
        if (ex instanceof WebClientResponseException responseException) {
            return new NormalizationException(
                    "Normalizer error: " + responseException.getMessage(),
                    responseException.getStatusCode().value(),
                    responseException
            );
        }
        if (ex instanceof CallNotPermittedException) {
            return new NormalizationException("Normalizer unavailable: circuit breaker is open", ex);
        }
        return new NormalizationException("Unexpected error calling normalizer: " + ex.getMessage(), ex);
    }
}
