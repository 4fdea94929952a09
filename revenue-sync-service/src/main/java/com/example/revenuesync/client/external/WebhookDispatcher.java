package com.example.revenuesync.client.external;

import com.example.revenuesync.config.SyncProperties;
import com.example.revenuesync.dto.WebhookPayload;
import com.example.revenuesync.dto.WebhookResponseDto;
import com.example.revenuesync.metrics.SyncMetrics;
import com.example.revenuesync.model.Batch;
import com.example.revenuesync.model.DispatchResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Client for the OptiQo bookings webhook.
 *
 * Sends one {@code POST /webhook} per batch and classifies every attempt:
 * - 2xx: SUCCESS
 * - 5xx, connect failure, reset, timeout: RETRYABLE
 * - 3xx, 4xx: FATAL, never retried
 *
 * Retries and backoff are owned by the {@code webhook} resilience4j retry, which repeats
 * while the outcome is RETRYABLE. This class never throws for HTTP or transport errors;
 * the caller decides what a non-success result means for the run.
 */
@Component
@Slf4j
public class WebhookDispatcher implements BatchDispatcher {

    public static final String WEBHOOK_PATH = "/webhook";
    public static final String API_KEY_HEADER = "X-Api-Key";

    private static final int MAX_DETAIL_LENGTH = 500;

    private final WebClient webhookWebClient;
    private final Retry webhookRetry;
    private final ObjectMapper objectMapper;
    private final SyncMetrics syncMetrics;
    private final String apiKey;
    private final Duration responseTimeout;

    public WebhookDispatcher(@Qualifier("webhookWebClient") WebClient webhookWebClient,
                             @Qualifier("webhookRetry") Retry webhookRetry,
                             SyncProperties properties,
                             ObjectMapper objectMapper,
                             SyncMetrics syncMetrics) {
        this.webhookWebClient = webhookWebClient;
        this.webhookRetry = webhookRetry;
        this.objectMapper = objectMapper;
        this.syncMetrics = syncMetrics;
        this.apiKey = properties.getWebhook().getApiKey();
        this.responseTimeout = properties.getWebhook().getResponseTimeout();
    }

    /**
     * Send a batch, retrying transient failures.
     *
     * @return the final result; RETRYABLE means attempts ran out
     */
    @Override
    public DispatchResult dispatch(Batch batch) {
        byte[] body = serialize(batch);
        AtomicInteger attempts = new AtomicInteger();
        long startNanos = System.nanoTime();

        DispatchResult result = webhookRetry.executeSupplier(
                () -> attempt(batch.sequence(), body, attempts.incrementAndGet()));

        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        syncMetrics.recordBatchDispatched(result.outcome(), elapsed);

        if (result.isSuccess()) {
            log.info("Batch {} delivered: {} records, inserted={}, updated={}, attempts={}, {}ms",
                    batch.sequence(), batch.size(), result.inserted(), result.updated(),
                    result.attemptCount(), elapsed.toMillis());
        } else {
            log.error("❌ Batch {} {} after {} attempt(s): {}",
                    batch.range(), result.outcome(), result.attemptCount(), result.errorDetail());
        }
        return result;
    }

    byte[] serialize(Batch batch) {
        try {
            return objectMapper.writeValueAsBytes(new WebhookPayload(batch.records()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + batch.range(), e);
        }
    }

    private DispatchResult attempt(long sequence, byte[] body, int attempt) {
        syncMetrics.recordDispatchAttempt();
        log.debug("Sending batch {} (attempt {}, {} bytes)", sequence, attempt, body.length);

        ResponseEntity<String> response;
        try {
            response = webhookWebClient.post()
                    .uri(WEBHOOK_PATH)
                    .header(API_KEY_HEADER, apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .exchangeToMono(clientResponse -> clientResponse.toEntity(String.class))
                    .timeout(responseTimeout)
                    .block();
        } catch (RuntimeException e) {
            return classifyError(sequence, attempt, e);
        }

        if (response == null) {
            return DispatchResult.retryable(sequence, attempt, null, "Empty response");
        }
        return classifyResponse(sequence, attempt, response);
    }

    private DispatchResult classifyResponse(long sequence, int attempt, ResponseEntity<String> response) {
        int status = response.getStatusCode().value();

        if (response.getStatusCode().is2xxSuccessful()) {
            WebhookResponseDto counts = parseCounts(response.getBody());
            return DispatchResult.success(sequence, attempt, status,
                    counts != null ? counts.getInserted() : 0,
                    counts != null ? counts.getUpdated() : 0);
        }

        String detail = "HTTP " + status + ": " + abbreviate(response.getBody());
        if (response.getStatusCode().is5xxServerError()) {
            log.warn("Webhook server error on batch {} attempt {}: {}", sequence, attempt, detail);
            return DispatchResult.retryable(sequence, attempt, status, detail);
        }

        // 4xx is a request the receiver will keep rejecting; 3xx means the base URL is wrong
        log.error("Webhook rejected batch {} on attempt {}: {}", sequence, attempt, detail);
        return DispatchResult.fatal(sequence, attempt, status, detail);
    }

    private DispatchResult classifyError(long sequence, int attempt, RuntimeException e) {
        Throwable cause = Exceptions.unwrap(e);
        String detail;
        if (cause instanceof TimeoutException) {
            detail = "Timed out after " + responseTimeout.toMillis() + "ms";
        } else if (cause instanceof WebClientRequestException requestException) {
            detail = "Request failed: " + requestException.getMostSpecificCause().getMessage();
        } else {
            detail = cause.getClass().getSimpleName() + ": " + cause.getMessage();
        }
        log.warn("Webhook transport error on batch {} attempt {}: {}", sequence, attempt, detail);
        return DispatchResult.retryable(sequence, attempt, null, detail);
    }

    /**
     * Counts are optional; a non-JSON or empty body is not an error.
     */
    private WebhookResponseDto parseCounts(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(body, WebhookResponseDto.class);
        } catch (JsonProcessingException e) {
            log.debug("Webhook response is not JSON, ignoring counts: {}", abbreviate(body));
            return null;
        }
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= MAX_DETAIL_LENGTH ? body : body.substring(0, MAX_DETAIL_LENGTH) + "...";
    }
}
