package com.example.revenuesync.config;

import com.example.revenuesync.model.FailurePolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.LocalDate;

/**
 * Sync engine configuration, bound once at startup from the {@code sync} prefix.
 *
 * <pre>
 * sync:
 *   target-name: revenue-forecast
 *   source:
 *     host: ${MYSQL_HOST}
 *     database: bi_data
 *   webhook:
 *     base-url: ${APP_URL}
 *     api-key: ${BOOKINGS_SYNC_API_KEY}
 *   batch:
 *     max-records: 200
 *   retry:
 *     max-attempts: 3
 *   run:
 *     failure-policy: HALT
 * </pre>
 *
 * Collaborators receive this object through their constructors; nothing reads the
 * environment directly.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "sync")
public class SyncProperties {

    /** Name of the state row and of the run lock; one per deployment target. */
    @NotBlank
    private String targetName = "revenue-forecast";

    @Valid
    private Source source = new Source();

    @Valid
    private Webhook webhook = new Webhook();

    @Valid
    private Batch batch = new Batch();

    @Valid
    private Retry retry = new Retry();

    @Valid
    private Run run = new Run();

    @Data
    public static class Source {

        @NotBlank
        private String host = "localhost";

        @Min(1)
        private int port = 3306;

        @NotBlank
        private String database = "bi_data";

        private String username;

        private String password;

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(10);

        /** Rows fetched per keyset page. */
        @Min(1)
        private int pageSize = 1000;

        /** Per-page statement timeout. */
        @NotNull
        private Duration queryTimeout = Duration.ofMinutes(5);

        /** Only jobs created on or after this date are extracted; unset means no floor. */
        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
        private LocalDate createdSince;

        /** Reconnect attempts per page after a lost connection, on top of the first try. */
        @Min(0)
        private int reconnectAttempts = 2;

        @NotNull
        private Duration reconnectBackoff = Duration.ofSeconds(1);

        @Min(1)
        private int maxPoolSize = 2;

        public String jdbcUrl() {
            return "jdbc:mysql://" + host + ":" + port + "/" + database
                    + "?useCursorFetch=true&zeroDateTimeBehavior=CONVERT_TO_NULL"
                    + "&connectTimeout=" + connectTimeout.toMillis();
        }
    }

    @Data
    public static class Webhook {

        @NotBlank
        private String baseUrl = "https://optiqo.straker.co";

        /** Sent as X-Api-Key; a blank key is only usable for dry runs. */
        private String apiKey;

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(10);

        @NotNull
        private Duration responseTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Batch {

        @Min(1)
        private int maxRecords = 200;

        /** Upper bound of the serialized payload in bytes; 0 disables the byte bound. */
        @Min(0)
        private long maxBytes = 0;
    }

    @Data
    public static class Retry {

        /** Total attempts per batch, including the first. */
        @Min(1)
        private int maxAttempts = 3;

        @NotNull
        @DurationMin(millis = 1)
        private Duration initialInterval = Duration.ofSeconds(2);

        @DecimalMin("1.0")
        private double multiplier = 2.0;

        @DecimalMin("0.0")
        @DecimalMax(value = "1.0", inclusive = false)
        private double randomizationFactor = 0.5;
    }

    @Data
    public static class Run {

        @NotNull
        private FailurePolicy failurePolicy = FailurePolicy.HALT;

        /** Batches buffered between the producer and the dispatching thread. */
        @Min(1)
        private int queueCapacity = 4;

        /** Cancel the run cooperatively after this long; unset means no timeout. */
        private Duration timeout;

        @NotNull
        private Duration lockAtMostFor = Duration.ofHours(2);

        /** How long shutdown waits for the in-flight batch to reach a checkpoint. */
        @NotNull
        private Duration shutdownGracePeriod = Duration.ofSeconds(60);
    }
}
