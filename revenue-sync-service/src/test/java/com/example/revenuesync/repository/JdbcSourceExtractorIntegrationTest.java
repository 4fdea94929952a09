package com.example.revenuesync.repository;

import com.example.revenuesync.config.ResilienceConfig;
import com.example.revenuesync.config.SyncProperties;
import com.example.revenuesync.model.SourceRecord;
import com.example.revenuesync.model.Watermark;
import com.zaxxer.hikari.HikariDataSource;
import io.github.resilience4j.retry.Retry;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.sql.Statement;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Keyset extraction against a real MySQL schema shaped like bi_data.
 *
 * Page size is kept small so every scenario crosses page boundaries.
 */
@Testcontainers(disabledWithoutDocker = true)
class JdbcSourceExtractorIntegrationTest {

    private static final LocalDateTime T = LocalDateTime.of(2025, 4, 1, 9, 0);
    private static final int PAGE_SIZE = 3;

    @Container
    static MySQLContainer<?> mysql = new MySQLContainer<>("mysql:8.0")
            .withDatabaseName("bi_data")
            .withUsername("test")
            .withPassword("test")
            .withUrlParam("zeroDateTimeBehavior", "CONVERT_TO_NULL")
            .withInitScript("sql/bi_data_schema.sql");

    private static HikariDataSource dataSource;
    private JdbcTemplate jdbcTemplate;

    @BeforeAll
    static void openPool() {
        dataSource = new HikariDataSource();
        dataSource.setJdbcUrl(mysql.getJdbcUrl());
        dataSource.setUsername(mysql.getUsername());
        dataSource.setPassword(mysql.getPassword());
        dataSource.setMaximumPoolSize(2);
    }

    @AfterAll
    static void closePool() {
        if (dataSource != null) {
            dataSource.close();
        }
    }

    @BeforeEach
    void setUp() {
        jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.update("DELETE FROM jobs");
    }

    @Test
    void testFullScan_ReadsAllRowsInKeyOrderAcrossPages() {
        for (long key = 1; key <= 7; key++) {
            insertJob(key, "c-1", "g-1", T.plusMinutes(10 - key), null);
        }

        try (SourceRecordCursor cursor = extractor(null).openFullScan(null)) {
            List<SourceRecord> rows = drain(cursor);

            assertThat(rows).extracting(SourceRecord::key).containsExactly(1L, 2L, 3L, 4L, 5L, 6L, 7L);
            assertThat(cursor.rowsRead()).isEqualTo(7);
        }
    }

    @Test
    void testFullScan_JoinsCustomerGroupAndEntity() {
        insertJob(1, "c-1", "g-1", T, null);
        insertJob(2, "c-2", "g-2", T, null);
        insertJob(3, null, null, T, null);

        try (SourceRecordCursor cursor = extractor(null).openFullScan(null)) {
            List<SourceRecord> rows = drain(cursor);

            SourceRecord acme = rows.get(0);
            assertThat(acme.get(SourceJobQuery.COL_CUSTOMER)).isEqualTo("Acme Translations Ltd");
            assertThat(acme.get(SourceJobQuery.COL_GROUP)).isEqualTo("Acme APAC");
            assertThat(acme.get(SourceJobQuery.COL_ENTITY)).isEqualTo("Straker NZ");
            assertThat((BigDecimal) acme.get(SourceJobQuery.COL_QUOTE)).isEqualByComparingTo("1500.50");
            assertThat(acme.get(SourceJobQuery.COL_CURRENCY)).isEqualTo("NZD");

            assertThat(rows.get(1).get(SourceJobQuery.COL_GROUP)).isEqualTo("Globex EU");
            assertThat(rows.get(1).get(SourceJobQuery.COL_ENTITY)).isNull();

            assertThat(rows.get(2).get(SourceJobQuery.COL_CUSTOMER)).isNull();
            assertThat(rows.get(2).get(SourceJobQuery.COL_GROUP)).isNull();
        }
    }

    @Test
    void testFullScan_ResumesAfterCheckpointKey() {
        for (long key = 1; key <= 7; key++) {
            insertJob(key, "c-1", "g-1", T, null);
        }

        try (SourceRecordCursor cursor = extractor(null).openFullScan(4L)) {
            assertThat(drain(cursor)).extracting(SourceRecord::key).containsExactly(5L, 6L, 7L);
        }
    }

    @Test
    void testIncremental_OrdersByChangeTimeThenKey() {
        insertJob(1, "c-1", "g-1", T.plusHours(2), null);
        insertJob(2, "c-1", "g-1", T, null);
        insertJob(3, "c-1", "g-1", T, null);
        insertJob(4, "c-1", "g-1", T.minusDays(1), T.plusHours(1));
        insertJob(5, "c-1", "g-1", T, null);

        try (SourceRecordCursor cursor = extractor(null).openIncremental(null)) {
            List<SourceRecord> rows = drain(cursor);

            assertThat(rows).extracting(SourceRecord::key).containsExactly(2L, 3L, 5L, 4L, 1L);
            // completion moves a job past its creation time
            assertThat(rows.get(3).changedAt()).isEqualTo(T.plusHours(1));
        }
    }

    @Test
    void testIncremental_ResumesInsideATimestampTie() {
        for (long key = 1; key <= 5; key++) {
            insertJob(key, "c-1", "g-1", T, null);
        }
        insertJob(6, "c-1", "g-1", T.plusSeconds(1), null);

        try (SourceRecordCursor cursor = extractor(null).openIncremental(Watermark.of(T, 2))) {
            assertThat(drain(cursor)).extracting(SourceRecord::key).containsExactly(3L, 4L, 5L, 6L);
        }
    }

    @Test
    void testIncremental_NothingNewAfterWatermark_ReturnsNoRows() {
        insertJob(1, "c-1", "g-1", T, null);
        insertJob(2, "c-1", "g-1", T.plusMinutes(1), null);

        try (SourceRecordCursor cursor = extractor(null).openIncremental(Watermark.of(T.plusMinutes(1), 2))) {
            assertThat(cursor.hasNext()).isFalse();
        }
    }

    @Test
    void testCreatedSinceFloor_ExcludesOlderJobs() {
        insertJob(1, "c-1", "g-1", LocalDateTime.of(2025, 3, 31, 23, 59), null);
        insertJob(2, "c-1", "g-1", LocalDateTime.of(2025, 4, 1, 0, 0), null);
        insertJob(3, "c-1", "g-1", LocalDateTime.of(2025, 5, 2, 8, 0), null);
        // created before the floor but completed after it: still excluded
        insertJob(4, "c-1", "g-1", LocalDateTime.of(2025, 1, 15, 8, 0), LocalDateTime.of(2025, 6, 1, 8, 0));

        LocalDate floor = LocalDate.of(2025, 4, 1);
        try (SourceRecordCursor full = extractor(floor).openFullScan(null)) {
            assertThat(drain(full)).extracting(SourceRecord::key).containsExactly(2L, 3L);
        }
        try (SourceRecordCursor incremental = extractor(floor).openIncremental(null)) {
            assertThat(drain(incremental)).extracting(SourceRecord::key).containsExactly(2L, 3L);
        }
    }

    @Test
    void testZeroCreatedDate_IsReadAsNullInsteadOfFailingThePage() {
        insertJob(1, "c-1", "g-1", T, null);
        jdbcTemplate.execute((ConnectionCallback<Void>) connection -> {
            try (Statement statement = connection.createStatement()) {
                statement.execute("SET SESSION sql_mode = ''");
                statement.executeUpdate("""
                        INSERT INTO jobs (job_id, client_uuid, group_uuid, job_created, completed_date,
                                          quote, quote_currency, job_status, gross_margin)
                        VALUES (2, 'c-1', 'g-1', '0000-00-00 00:00:00', NULL, 1500.50, 'NZD', 'In Progress', 25.50)
                        """);
                statement.execute("SET SESSION sql_mode = DEFAULT");
            }
            return null;
        });
        insertJob(3, "c-1", "g-1", T, null);

        try (SourceRecordCursor cursor = extractor(null).openFullScan(null)) {
            List<SourceRecord> rows = drain(cursor);

            assertThat(rows).extracting(SourceRecord::key).containsExactly(1L, 2L, 3L);
            assertThat(rows.get(0).get(SourceJobQuery.COL_JOB_CREATED)).isNotNull();
            assertThat(rows.get(1).get(SourceJobQuery.COL_JOB_CREATED)).isNull();
        }
    }

    @Test
    void testExactMultipleOfPageSize_EndsWithEmptyPage() {
        for (long key = 1; key <= PAGE_SIZE * 2; key++) {
            insertJob(key, "c-1", "g-1", T, null);
        }

        try (SourceRecordCursor cursor = extractor(null).openFullScan(null)) {
            assertThat(drain(cursor)).hasSize(PAGE_SIZE * 2);
            assertThat(cursor.hasNext()).isFalse();
        }
    }

    private JdbcSourceExtractor extractor(LocalDate createdSince) {
        SyncProperties properties = new SyncProperties();
        properties.getSource().setPageSize(PAGE_SIZE);
        properties.getSource().setCreatedSince(createdSince);
        Retry retry = Retry.of(ResilienceConfig.SOURCE_RETRY,
                ResilienceConfig.sourceRetryConfig(properties.getSource()));
        return new JdbcSourceExtractor(jdbcTemplate, retry, properties);
    }

    private void insertJob(long key, String clientUuid, String groupUuid,
                           LocalDateTime created, LocalDateTime completed) {
        jdbcTemplate.update("""
                INSERT INTO jobs (job_id, client_uuid, group_uuid, job_created, completed_date,
                                  quote, quote_currency, job_status, gross_margin)
                VALUES (?, ?, ?, ?, ?, 1500.50, 'NZD', ?, 25.50)
                """, key, clientUuid, groupUuid, created, completed, completed != null ? "Completed" : "In Progress");
    }

    private static List<SourceRecord> drain(SourceRecordCursor cursor) {
        List<SourceRecord> rows = new ArrayList<>();
        while (cursor.hasNext()) {
            rows.add(cursor.next());
        }
        return rows;
    }
}
