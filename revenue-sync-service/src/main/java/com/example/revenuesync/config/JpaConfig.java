package com.example.revenuesync.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * JPA auditing fills created_at / updated_at on sync_state and sync_runs.
 */
@Configuration
@EnableJpaAuditing
public class JpaConfig {
}
