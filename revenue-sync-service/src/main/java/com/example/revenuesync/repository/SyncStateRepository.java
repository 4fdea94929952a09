package com.example.revenuesync.repository;

import com.example.revenuesync.entity.SyncStateEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SyncStateRepository extends JpaRepository<SyncStateEntity, String> {
}
