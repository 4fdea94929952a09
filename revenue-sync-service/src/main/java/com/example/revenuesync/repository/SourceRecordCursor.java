package com.example.revenuesync.repository;

import com.example.revenuesync.model.SourceRecord;

import java.util.Iterator;

/**
 * Lazy, finite, forward-only sequence of source rows.
 *
 * There is no rewind: to read again, open a new cursor from a committed position.
 * {@link #hasNext()} and {@link #next()} may throw
 * {@link com.example.revenuesync.exception.ExtractionException}.
 */
public interface SourceRecordCursor extends Iterator<SourceRecord>, AutoCloseable {

    /** Rows handed out so far. */
    long rowsRead();

    @Override
    void close();
}
