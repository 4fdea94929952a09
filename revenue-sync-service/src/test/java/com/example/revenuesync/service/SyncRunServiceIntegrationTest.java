package com.example.revenuesync.service;

import com.example.revenuesync.config.JpaConfig;
import com.example.revenuesync.dto.SyncSummaryDto;
import com.example.revenuesync.entity.SyncRun;
import com.example.revenuesync.model.RunStage;
import com.example.revenuesync.model.RunStatus;
import com.example.revenuesync.model.SyncMode;
import com.example.revenuesync.model.Watermark;
import com.example.revenuesync.repository.SyncRunRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Testcontainers(disabledWithoutDocker = true)
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({SyncRunService.class, JpaConfig.class})
class SyncRunServiceIntegrationTest {

    private static final String TARGET = "revenue-forecast";

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("revenue_sync")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.flyway.enabled", () -> "true");
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "validate");
        registry.add("sync.target-name", () -> TARGET);
    }

    @Autowired
    private SyncRunService syncRunService;

    @Autowired
    private SyncRunRepository syncRunRepository;

    @Autowired
    private TestEntityManager entityManager;

    @Test
    void testStartRun_CreatesRunningRow() {
        Watermark start = Watermark.of(LocalDateTime.of(2025, 4, 1, 9, 0), 42);

        SyncRun run = syncRunService.startRun(SyncMode.INCREMENTAL, "SYNC-abcd1234", start);
        entityManager.flush();
        entityManager.clear();

        SyncRun stored = syncRunRepository.findById(run.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(SyncRun.Status.RUNNING);
        assertThat(stored.getTargetName()).isEqualTo(TARGET);
        assertThat(stored.getMode()).isEqualTo(SyncMode.INCREMENTAL);
        assertThat(stored.getCorrelationId()).isEqualTo("SYNC-abcd1234");
        assertThat(stored.getStartWatermark()).isEqualTo(start.toString());
        assertThat(stored.getStartedAt()).isNotNull();
        assertThat(stored.getCreatedAt()).isNotNull();
    }

    @Test
    void testStartRun_ClosesRunsAbandonedByACrashedProcess() {
        SyncRun crashed = syncRunService.startRun(SyncMode.FULL, "SYNC-crashed1", null);
        entityManager.flush();

        SyncRun next = syncRunService.startRun(SyncMode.INCREMENTAL, "SYNC-next0001", null);
        entityManager.flush();
        entityManager.clear();

        SyncRun abandoned = syncRunRepository.findById(crashed.getId()).orElseThrow();
        assertThat(abandoned.getStatus()).isEqualTo(SyncRun.Status.FAILED);
        assertThat(abandoned.getCompletedAt()).isNotNull();
        assertThat(abandoned.getErrorMessage()).startsWith("Abandoned");
        assertThat(syncRunRepository.findByTargetNameAndStatusOrderByStartedAtAsc(TARGET, SyncRun.Status.RUNNING))
                .extracting(SyncRun::getId)
                .containsExactly(next.getId());
    }

    @Test
    void testFinishRun_StoresCountersAndOutcome() {
        SyncRun run = syncRunService.startRun(SyncMode.INCREMENTAL, "SYNC-abcd1234", null);
        SyncSummaryDto summary = SyncSummaryDto.builder()
                .status(RunStatus.COMPLETED_WITH_FAILURES)
                .recordsRead(450)
                .recordsMapped(448)
                .recordsSkipped(2)
                .batchesSent(2)
                .batchesFailed(1)
                .finalWatermark(Watermark.of(LocalDateTime.of(2025, 4, 1, 9, 7, 30), 450))
                .build();

        syncRunService.finishRun(run.getId(), summary);
        entityManager.flush();
        entityManager.clear();

        SyncRun stored = syncRunRepository.findById(run.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(SyncRun.Status.COMPLETED_WITH_FAILURES);
        assertThat(stored.getRecordsRead()).isEqualTo(450L);
        assertThat(stored.getRecordsSkipped()).isEqualTo(2L);
        assertThat(stored.getBatchesSent()).isEqualTo(2L);
        assertThat(stored.getBatchesFailed()).isEqualTo(1L);
        assertThat(stored.getFinalWatermark()).isEqualTo("2025-04-01T09:07:30#450");
        assertThat(stored.getDurationMs()).isNotNull().isGreaterThanOrEqualTo(0L);
    }

    @Test
    void testFinishRun_FailureKeepsStageAndTruncatedError() {
        SyncRun run = syncRunService.startRun(SyncMode.FULL, "SYNC-abcd1234", null);
        SyncSummaryDto summary = SyncSummaryDto.builder()
                .status(RunStatus.FAILED)
                .failedStage(RunStage.DISPATCH)
                .errorMessage("x".repeat(5000))
                .build();

        syncRunService.finishRun(run.getId(), summary);
        entityManager.flush();
        entityManager.clear();

        SyncRun stored = syncRunRepository.findById(run.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(SyncRun.Status.FAILED);
        assertThat(stored.getFailedStage()).isEqualTo(RunStage.DISPATCH);
        assertThat(stored.getErrorMessage()).hasSize(SyncRunService.MAX_ERROR_LENGTH);
    }

    @Test
    void testToAuditStatus_LockedIsRecordedAsFailed() {
        assertThat(SyncRunService.toAuditStatus(RunStatus.LOCKED)).isEqualTo(SyncRun.Status.FAILED);
        assertThat(SyncRunService.toAuditStatus(RunStatus.CANCELLED)).isEqualTo(SyncRun.Status.CANCELLED);
        assertThat(SyncRunService.toAuditStatus(null)).isEqualTo(SyncRun.Status.FAILED);
    }
}
