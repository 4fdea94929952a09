package com.example.revenuesync.repository;

import com.example.revenuesync.entity.SyncRun;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for the run audit trail.
 */
@Repository
public interface SyncRunRepository extends JpaRepository<SyncRun, Long> {

    /**
     * Runs of a target in the given status, oldest first.
     * With RUNNING this finds runs whose process died before finishing.
     */
    List<SyncRun> findByTargetNameAndStatusOrderByStartedAtAsc(String targetName, SyncRun.Status status);
}
