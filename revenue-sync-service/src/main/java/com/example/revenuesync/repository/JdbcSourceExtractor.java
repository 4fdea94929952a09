package com.example.revenuesync.repository;

import com.example.revenuesync.config.SyncProperties;
import com.example.revenuesync.exception.ExtractionException;
import com.example.revenuesync.model.SourceRecord;
import com.example.revenuesync.model.SyncMode;
import com.example.revenuesync.model.Watermark;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.JdbcUtils;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Reads jobs from the MySQL source one keyset page at a time.
 *
 * Each page is a separate statement, so no connection is held between pages and a lost
 * connection only costs the page being read. Lost connections are retried through the
 * {@code source} retry; anything else ends extraction.
 */
@Slf4j
@Component
public class JdbcSourceExtractor implements SourceExtractor {

    private final JdbcTemplate jdbcTemplate;
    private final Retry sourceRetry;
    private final int pageSize;
    private final LocalDate createdSince;

    public JdbcSourceExtractor(@Qualifier("sourceJdbcTemplate") JdbcTemplate jdbcTemplate,
                               @Qualifier("sourceRetry") Retry sourceRetry,
                               SyncProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.sourceRetry = sourceRetry;
        this.pageSize = properties.getSource().getPageSize();
        this.createdSince = properties.getSource().getCreatedSince();
    }

    @Override
    public SourceRecordCursor openFullScan(Long afterKey) {
        log.info("Opening full scan (afterKey={}, createdSince={}, pageSize={})", afterKey, createdSince, pageSize);
        return new KeysetCursor(SyncMode.FULL, null, afterKey);
    }

    @Override
    public SourceRecordCursor openIncremental(Watermark after) {
        log.info("Opening incremental scan (after={}, createdSince={}, pageSize={})", after, createdSince, pageSize);
        return new KeysetCursor(SyncMode.INCREMENTAL, after, null);
    }

    private List<SourceRecord> fetchPage(SourceJobQuery.Page page) {
        try {
            return sourceRetry.executeSupplier(
                    () -> jdbcTemplate.query(page.sql(), JdbcSourceExtractor::mapRow, page.argArray()));
        } catch (DataAccessException e) {
            throw new ExtractionException("Source query failed: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    static SourceRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        ResultSetMetaData metaData = rs.getMetaData();
        Map<String, Object> columns = new LinkedHashMap<>();
        for (int i = 1; i <= metaData.getColumnCount(); i++) {
            columns.put(JdbcUtils.lookupColumnName(metaData, i), JdbcUtils.getResultSetValue(rs, i));
        }
        long key = rs.getLong(SourceJobQuery.COL_JOB_ID);
        LocalDateTime changedAt = rs.getObject(SourceJobQuery.COL_CHANGED_AT, LocalDateTime.class);
        // zero dates arrive as NULL; order them first like the query's own fallback
        return new SourceRecord(key, changedAt != null ? changedAt : SourceJobQuery.CHANGED_AT_FLOOR, columns);
    }

    /**
     * Fetches the next page when the current one is used up. A short page means the end
     * of the result; an empty page too.
     */
    private final class KeysetCursor implements SourceRecordCursor {

        private final SyncMode mode;
        private Watermark lastPosition;
        private Long lastKey;

        private Iterator<SourceRecord> page = Collections.emptyIterator();
        private boolean lastPage;
        private boolean closed;
        private long rowsRead;
        private int pagesRead;

        private KeysetCursor(SyncMode mode, Watermark after, Long afterKey) {
            this.mode = mode;
            this.lastPosition = after;
            this.lastKey = afterKey;
        }

        @Override
        public boolean hasNext() {
            if (closed) {
                return false;
            }
            if (!page.hasNext() && !lastPage) {
                List<SourceRecord> rows = fetchPage(nextPageQuery());
                pagesRead++;
                lastPage = rows.size() < pageSize;
                page = rows.iterator();
                log.debug("Fetched source page {} ({} rows)", pagesRead, rows.size());
            }
            return page.hasNext();
        }

        @Override
        public SourceRecord next() {
            if (!hasNext()) {
                throw new NoSuchElementException("Source cursor exhausted");
            }
            SourceRecord record = page.next();
            lastKey = record.key();
            lastPosition = record.position();
            rowsRead++;
            return record;
        }

        private SourceJobQuery.Page nextPageQuery() {
            return mode == SyncMode.FULL
                    ? SourceJobQuery.fullScanPage(lastKey, createdSince, pageSize)
                    : SourceJobQuery.incrementalPage(lastPosition, createdSince, pageSize);
        }

        @Override
        public long rowsRead() {
            return rowsRead;
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                page = Collections.emptyIterator();
                log.debug("Source cursor closed after {} rows in {} pages", rowsRead, pagesRead);
            }
        }
    }
}
