package com.example.revenuesync.client.external;

import com.example.revenuesync.SourceRows;
import com.example.revenuesync.config.ResilienceConfig;
import com.example.revenuesync.config.SyncProperties;
import com.example.revenuesync.dto.MappedRecord;
import com.example.revenuesync.metrics.SyncMetrics;
import com.example.revenuesync.model.Batch;
import com.example.revenuesync.model.DispatchOutcome;
import com.example.revenuesync.model.DispatchResult;
import com.example.revenuesync.service.RecordMapper;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class WebhookDispatcherTest {

    private static final String BASE_URL = "https://optiqo.test";
    private static final String API_KEY = "test-api-key";

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final List<ClientRequest> requests = new ArrayList<>();

    private SyncProperties properties;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        properties = new SyncProperties();
        properties.getWebhook().setBaseUrl(BASE_URL);
        properties.getWebhook().setApiKey(API_KEY);
        properties.getWebhook().setResponseTimeout(Duration.ofMillis(200));
        properties.getRetry().setMaxAttempts(3);
        properties.getRetry().setInitialInterval(Duration.ofMillis(1));
        meterRegistry = new SimpleMeterRegistry();
    }

    @Test
    void testSuccess_PostsToWebhookWithApiKey_AndReadsCounts() {
        WebhookDispatcher dispatcher = dispatcher(request ->
                json(HttpStatus.OK, "{\"inserted\":2,\"updated\":1,\"total\":3}"));

        DispatchResult result = dispatcher.dispatch(batch(1, 3));

        assertThat(result.outcome()).isEqualTo(DispatchOutcome.SUCCESS);
        assertThat(result.attemptCount()).isEqualTo(1);
        assertThat(result.httpStatus()).isEqualTo(200);
        assertThat(result.inserted()).isEqualTo(2);
        assertThat(result.updated()).isEqualTo(1);

        assertThat(requests).hasSize(1);
        ClientRequest request = requests.get(0);
        assertThat(request.method()).isEqualTo(HttpMethod.POST);
        assertThat(request.url().toString()).isEqualTo(BASE_URL + "/webhook");
        assertThat(request.headers().getFirst(WebhookDispatcher.API_KEY_HEADER)).isEqualTo(API_KEY);
        assertThat(request.headers().getContentType()).isEqualTo(MediaType.APPLICATION_JSON);
    }

    @Test
    void testTimeoutTwiceThenSuccess_ReportsThreeAttempts() {
        AtomicInteger calls = new AtomicInteger();
        WebhookDispatcher dispatcher = dispatcher(request ->
                calls.incrementAndGet() <= 2 ? Mono.never() : json(HttpStatus.OK, "{}"));

        DispatchResult result = dispatcher.dispatch(batch(1, 2));

        assertThat(result.outcome()).isEqualTo(DispatchOutcome.SUCCESS);
        assertThat(result.attemptCount()).isEqualTo(3);
        assertThat(requests).hasSize(3);
        assertThat(meterRegistry.get("sync_dispatch_attempts_total").counter().count()).isEqualTo(3.0);
    }

    @Test
    void testConnectionFailure_IsRetried() {
        AtomicInteger calls = new AtomicInteger();
        WebhookDispatcher dispatcher = dispatcher(request -> calls.incrementAndGet() == 1
                ? Mono.error(new WebClientRequestException(new ConnectException("Connection refused"),
                        request.method(), request.url(), request.headers()))
                : json(HttpStatus.CREATED, ""));

        DispatchResult result = dispatcher.dispatch(batch(1, 1));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.attemptCount()).isEqualTo(2);
        assertThat(result.httpStatus()).isEqualTo(201);
    }

    @Test
    void testUnauthorized_IsFatalWithoutRetry() {
        WebhookDispatcher dispatcher = dispatcher(request -> json(HttpStatus.UNAUTHORIZED, "{\"error\":\"bad key\"}"));

        DispatchResult result = dispatcher.dispatch(batch(1, 5));

        assertThat(result.outcome()).isEqualTo(DispatchOutcome.FATAL);
        assertThat(result.attemptCount()).isEqualTo(1);
        assertThat(result.httpStatus()).isEqualTo(401);
        assertThat(result.errorDetail()).contains("HTTP 401").contains("bad key");
        assertThat(requests).hasSize(1);
    }

    @Test
    void testRedirect_IsFatal() {
        WebhookDispatcher dispatcher = dispatcher(request -> json(HttpStatus.FOUND, ""));

        DispatchResult result = dispatcher.dispatch(batch(1, 1));

        assertThat(result.isFatal()).isTrue();
        assertThat(requests).hasSize(1);
    }

    @Test
    void testServerErrorOnEveryAttempt_EndsRetryable() {
        WebhookDispatcher dispatcher = dispatcher(request -> json(HttpStatus.SERVICE_UNAVAILABLE, "maintenance"));

        DispatchResult result = dispatcher.dispatch(batch(1, 1));

        assertThat(result.outcome()).isEqualTo(DispatchOutcome.RETRYABLE);
        assertThat(result.attemptCount()).isEqualTo(3);
        assertThat(result.httpStatus()).isEqualTo(503);
        assertThat(requests).hasSize(3);
        assertThat(meterRegistry.get("sync_batches_total").tag("outcome", "retryable").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void testNonJsonSuccessBody_IsTolerated() {
        WebhookDispatcher dispatcher = dispatcher(request -> json(HttpStatus.OK, "OK"));

        DispatchResult result = dispatcher.dispatch(batch(1, 1));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.inserted()).isZero();
        assertThat(result.updated()).isZero();
    }

    @Test
    void testPayload_WrapsRecordsUnderData() throws Exception {
        WebhookDispatcher dispatcher = dispatcher(request -> json(HttpStatus.OK, "{}"));

        JsonNode payload = objectMapper.readTree(dispatcher.serialize(batch(10, 12)));

        assertThat(payload.fieldNames()).toIterable().containsExactly("data");
        assertThat(payload.get("data")).hasSize(3);
        assertThat(payload.get("data").get(0).get("TJ").asText()).isEqualTo("TJ10");
        assertThat(payload.get("data").get(2).get("TJ").asText()).isEqualTo("TJ12");
    }

    private WebhookDispatcher dispatcher(ExchangeFunction responder) {
        WebClient webClient = WebClient.builder()
                .baseUrl(BASE_URL)
                .exchangeFunction(request -> {
                    requests.add(request);
                    return responder.exchange(request);
                })
                .build();
        Retry retry = Retry.of(ResilienceConfig.WEBHOOK_RETRY, ResilienceConfig.webhookRetryConfig(properties.getRetry()));
        return new WebhookDispatcher(webClient, retry, properties, objectMapper, new SyncMetrics(meterRegistry));
    }

    private static Mono<ClientResponse> json(HttpStatus status, String body) {
        return Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
    }

    private static Batch batch(long fromKey, long toKey) {
        RecordMapper mapper = new RecordMapper();
        List<MappedRecord> records = new ArrayList<>();
        for (long key = fromKey; key <= toKey; key++) {
            records.add(mapper.map(SourceRows.row(key)));
        }
        return new Batch(1, records,
                SourceRows.row(fromKey).position(),
                SourceRows.row(toKey).position(),
                SourceRows.row(toKey).position());
    }
}
