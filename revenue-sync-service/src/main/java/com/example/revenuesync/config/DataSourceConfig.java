package com.example.revenuesync.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Two data sources:
 * - the primary one (spring.datasource) holds sync state, run audit and the shedlock table
 * - the source one (sync.source) is the read-only MySQL schema the jobs are extracted from
 *
 * Declaring the source pool switches off Spring Boot's single DataSource auto-configuration,
 * so the primary pool is declared here as well.
 */
@Configuration
@Slf4j
public class DataSourceConfig {

    @Bean
    @Primary
    @ConfigurationProperties("spring.datasource")
    public DataSourceProperties stateDataSourceProperties() {
        return new DataSourceProperties();
    }

    @Bean
    @Primary
    @ConfigurationProperties("spring.datasource.hikari")
    public HikariDataSource stateDataSource(DataSourceProperties stateDataSourceProperties) {
        return stateDataSourceProperties.initializeDataSourceBuilder()
                .type(HikariDataSource.class)
                .build();
    }

    @Bean(name = "sourceDataSource", destroyMethod = "close")
    public HikariDataSource sourceDataSource(SyncProperties properties) {
        SyncProperties.Source source = properties.getSource();

        HikariConfig config = new HikariConfig();
        config.setPoolName("source-pool");
        config.setJdbcUrl(source.jdbcUrl());
        config.setUsername(source.getUsername());
        config.setPassword(source.getPassword());
        config.setMaximumPoolSize(source.getMaxPoolSize());
        config.setMinimumIdle(0);
        config.setConnectionTimeout(source.getConnectTimeout().toMillis());
        config.setReadOnly(true);
        config.setAutoCommit(true);
        // Pool starts without a reachable source; connection errors surface on the first page query
        config.setInitializationFailTimeout(-1);

        log.info("Source DataSource configured for {}:{}/{}", source.getHost(), source.getPort(), source.getDatabase());
        return new HikariDataSource(config);
    }

    @Bean(name = "sourceJdbcTemplate")
    public JdbcTemplate sourceJdbcTemplate(@Qualifier("sourceDataSource") DataSource sourceDataSource,
                                           SyncProperties properties) {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(sourceDataSource);
        jdbcTemplate.setFetchSize(properties.getSource().getPageSize());
        jdbcTemplate.setQueryTimeout((int) properties.getSource().getQueryTimeout().toSeconds());
        return jdbcTemplate;
    }
}
