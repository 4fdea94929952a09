package com.example.revenuesync.repository;

import com.example.revenuesync.model.Watermark;

/**
 * Opens cursors over the source table.
 */
public interface SourceExtractor {

    /**
     * Full scan in primary key order.
     *
     * @param afterKey resume strictly after this key; null scans from the first row
     */
    SourceRecordCursor openFullScan(Long afterKey);

    /**
     * Rows strictly after the given position, in (change column, key) order.
     *
     * @param after committed watermark; null reads every row
     */
    SourceRecordCursor openIncremental(Watermark after);
}
