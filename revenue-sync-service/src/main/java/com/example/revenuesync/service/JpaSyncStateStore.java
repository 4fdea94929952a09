package com.example.revenuesync.service;

import com.example.revenuesync.config.SyncProperties;
import com.example.revenuesync.entity.SyncStateEntity;
import com.example.revenuesync.exception.StateCommitException;
import com.example.revenuesync.model.SyncState;
import com.example.revenuesync.model.Watermark;
import com.example.revenuesync.repository.SyncStateRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Objects;
import java.util.Optional;

/**
 * Sync state kept in the {@code sync_state} table, one row per target.
 *
 * Transactions are short: one read, one flushed write. The {@code @Version} column makes a
 * concurrent writer fail instead of silently overwriting.
 */
@Service
@Slf4j
public class JpaSyncStateStore implements SyncStateStore {

    private final SyncStateRepository syncStateRepository;
    private final String targetName;

    public JpaSyncStateStore(SyncStateRepository syncStateRepository, SyncProperties properties) {
        this.syncStateRepository = syncStateRepository;
        this.targetName = properties.getTargetName();
    }

    @Override
    @Transactional(readOnly = true)
    public SyncState read() {
        return syncStateRepository.findById(targetName)
                .map(JpaSyncStateStore::toState)
                .orElseGet(() -> SyncState.initial(targetName));
    }

    @Override
    @Transactional
    public SyncState commit(SyncState expected, SyncState next) {
        if (!targetName.equals(next.getTargetName())) {
            throw new StateCommitException("State for target '" + next.getTargetName()
                    + "' cannot be committed by the store of '" + targetName + "'");
        }

        try {
            Optional<SyncStateEntity> existing = syncStateRepository.findById(targetName);
            SyncState stored = existing.map(JpaSyncStateStore::toState).orElse(null);

            Long storedVersion = stored != null ? stored.getVersion() : null;
            if (!Objects.equals(storedVersion, expected.getVersion())) {
                throw new StateCommitException("Stale sync state for '" + targetName + "': expected version "
                        + expected.getVersion() + " but found " + storedVersion);
            }
            if (stored != null) {
                checkMonotonic(stored, next);
            }

            SyncStateEntity entity = existing.orElseGet(() -> SyncStateEntity.builder().targetName(targetName).build());
            apply(next, entity);
            SyncStateEntity saved = syncStateRepository.saveAndFlush(entity);

            SyncState committed = toState(saved);
            log.debug("Committed sync state target={} watermark={} resumeKey={} version={}",
                    targetName, committed.getWatermark(), committed.getResumeKey(), committed.getVersion());
            return committed;

        } catch (DataAccessException e) {
            throw new StateCommitException("Failed to persist sync state for '" + targetName + "': "
                    + e.getMostSpecificCause().getMessage(), e);
        }
    }

    private void checkMonotonic(SyncState stored, SyncState next) {
        Watermark current = stored.getWatermark();
        Watermark proposed = next.getWatermark();
        if (current != null && current.isAfter(proposed)) {
            throw new StateCommitException("Watermark regression for '" + targetName + "': "
                    + current + " -> " + proposed);
        }

        Long currentResume = stored.getResumeKey();
        Long proposedResume = next.getResumeKey();
        if (currentResume != null && proposedResume != null && proposedResume < currentResume) {
            throw new StateCommitException("Full-scan checkpoint regression for '" + targetName + "': "
                    + currentResume + " -> " + proposedResume);
        }
    }

    private static void apply(SyncState state, SyncStateEntity entity) {
        entity.setMode(state.getMode());
        entity.setWatermarkChangedAt(state.getWatermark() != null ? state.getWatermark().changedAt() : null);
        entity.setWatermarkKey(state.getWatermark() != null ? state.getWatermark().key() : null);
        entity.setResumeKey(state.getResumeKey());
        entity.setPendingChangedAt(state.getPendingWatermark() != null ? state.getPendingWatermark().changedAt() : null);
        entity.setPendingKey(state.getPendingWatermark() != null ? state.getPendingWatermark().key() : null);
        entity.setLastRunAt(state.getLastRunAt());
    }

    static SyncState toState(SyncStateEntity entity) {
        return SyncState.builder()
                .targetName(entity.getTargetName())
                .mode(entity.getMode())
                .watermark(position(entity.getWatermarkChangedAt(), entity.getWatermarkKey()))
                .resumeKey(entity.getResumeKey())
                .pendingWatermark(position(entity.getPendingChangedAt(), entity.getPendingKey()))
                .lastRunAt(entity.getLastRunAt())
                .version(entity.getVersion())
                .build();
    }

    private static Watermark position(java.time.LocalDateTime changedAt, Long key) {
        return changedAt != null && key != null ? Watermark.of(changedAt, key) : null;
    }
}
