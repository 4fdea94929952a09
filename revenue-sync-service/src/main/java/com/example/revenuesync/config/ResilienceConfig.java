package com.example.revenuesync.config;

import com.example.revenuesync.model.DispatchOutcome;
import com.example.revenuesync.model.DispatchResult;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;

/**
 * Resilience4j retries.
 *
 * webhook: result-based. The dispatcher classifies every attempt into a DispatchResult and
 * the retry repeats while the outcome is RETRYABLE, with exponential backoff plus jitter.
 * When attempts run out the last RETRYABLE result is returned, not thrown.
 *
 * source: exception-based, only for lost or unavailable connections while fetching a page.
 */
@Slf4j
@Configuration
public class ResilienceConfig {

    public static final String WEBHOOK_RETRY = "webhook";
    public static final String SOURCE_RETRY = "source";

    @Bean
    public RetryRegistry retryRegistry(SyncProperties properties) {
        RetryRegistry registry = RetryRegistry.ofDefaults();

        Retry webhookRetry = registry.retry(WEBHOOK_RETRY, webhookRetryConfig(properties.getRetry()));
        webhookRetry.getEventPublisher()
                .onRetry(event -> log.warn("Webhook attempt #{} failed, retrying in {}ms",
                        event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis()));

        Retry sourceRetry = registry.retry(SOURCE_RETRY, sourceRetryConfig(properties.getSource()));
        sourceRetry.getEventPublisher()
                .onRetry(event -> log.warn("Source query reconnect attempt #{}: {}",
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "n/a"))
                .onError(event -> log.error("Source query failed after {} reconnect attempts",
                        event.getNumberOfRetryAttempts(), event.getLastThrowable()));

        return registry;
    }

    @Bean(name = "webhookRetry")
    public Retry webhookRetry(RetryRegistry retryRegistry) {
        return retryRegistry.retry(WEBHOOK_RETRY);
    }

    @Bean(name = "sourceRetry")
    public Retry sourceRetry(RetryRegistry retryRegistry) {
        return retryRegistry.retry(SOURCE_RETRY);
    }

    /**
     * Wait before attempt k+1 is initialInterval * multiplier^(k-1), randomized by
     * +/- randomizationFactor.
     */
    public static RetryConfig webhookRetryConfig(SyncProperties.Retry retry) {
        return RetryConfig.<DispatchResult>custom()
                .maxAttempts(retry.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialRandomBackoff(
                        retry.getInitialInterval().toMillis(),
                        retry.getMultiplier(),
                        retry.getRandomizationFactor()))
                .retryOnResult(result -> result.outcome() == DispatchOutcome.RETRYABLE)
                .failAfterMaxAttempts(false)
                .build();
    }

    public static RetryConfig sourceRetryConfig(SyncProperties.Source source) {
        return RetryConfig.custom()
                .maxAttempts(source.getReconnectAttempts() + 1)
                .waitDuration(source.getReconnectBackoff())
                .retryExceptions(
                        TransientDataAccessException.class,
                        RecoverableDataAccessException.class,
                        DataAccessResourceFailureException.class)
                .build();
    }
}
