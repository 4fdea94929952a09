package com.example.revenuesync.runner;

import com.example.revenuesync.dto.SyncSummaryDto;
import com.example.revenuesync.model.RunStatus;
import com.example.revenuesync.model.SyncMode;
import com.example.revenuesync.service.SyncOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Command-line entry point: one run per process.
 *
 * {@code --full} selects a full scan (incremental otherwise), {@code --dry-run} extracts,
 * maps and batches without sending or committing. The run status becomes the exit code:
 * 0 completed, 1 failed, 2 cancelled, 3 locked by another run.
 */
@Component
@ConditionalOnProperty(name = "sync.runner.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class SyncCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String FULL_OPTION = "full";
    static final String DRY_RUN_OPTION = "dry-run";

    private static final Set<String> KNOWN_OPTIONS = Set.of(FULL_OPTION, DRY_RUN_OPTION);

    private final SyncOrchestrator syncOrchestrator;

    private volatile int exitCode = RunStatus.COMPLETED.exitCode();

    @Override
    public void run(ApplicationArguments args) {
        args.getOptionNames().stream()
                .filter(option -> !KNOWN_OPTIONS.contains(option) && !option.contains("."))
                .forEach(option -> log.warn("Ignoring unknown option --{}", option));

        SyncMode mode = args.containsOption(FULL_OPTION) ? SyncMode.FULL : SyncMode.INCREMENTAL;
        boolean dryRun = args.containsOption(DRY_RUN_OPTION);

        SyncSummaryDto summary = syncOrchestrator.run(mode, dryRun);
        exitCode = summary.exitCode();

        if (summary.getStatus() != null && summary.getStatus().isSuccessful()) {
            log.info("Sync finished with status {} (exit code {})", summary.getStatus(), exitCode);
        } else {
            log.error("Sync finished with status {} (exit code {}): {}",
                    summary.getStatus(), exitCode, summary.getErrorMessage());
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
