package com.example.revenuesync.service;

import com.example.revenuesync.config.SyncProperties;
import com.example.revenuesync.dto.MappedRecord;
import com.example.revenuesync.model.Batch;
import com.example.revenuesync.model.Watermark;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Groups mapped records into ordered, bounded batches.
 *
 * One instance per run; not thread-safe. Records keep their arrival order inside and
 * across batches. A batch is cut when it reaches {@code maxRecords}, or before a record
 * that would push the serialized payload past {@code maxBytes}. A record that alone is
 * larger than {@code maxBytes} goes out as a batch of one.
 */
public class Batcher {

    /** {"data":[]} */
    static final int ENVELOPE_BYTES = 11;

    private final int maxRecords;
    private final long maxBytes;
    private final ObjectMapper objectMapper;

    private final List<MappedRecord> pending = new ArrayList<>();
    private Watermark firstPosition;
    private Watermark lastPosition;
    private Watermark maxPosition;
    private long pendingBytes;
    private long nextSequence = 1;

    public Batcher(int maxRecords, long maxBytes, ObjectMapper objectMapper) {
        if (maxRecords < 1) {
            throw new IllegalArgumentException("maxRecords must be at least 1, got " + maxRecords);
        }
        if (maxBytes < 0) {
            throw new IllegalArgumentException("maxBytes must not be negative, got " + maxBytes);
        }
        this.maxRecords = maxRecords;
        this.maxBytes = maxBytes;
        this.objectMapper = objectMapper;
    }

    public static Batcher forRun(SyncProperties.Batch settings, ObjectMapper objectMapper) {
        return new Batcher(settings.getMaxRecords(), settings.getMaxBytes(), objectMapper);
    }

    /**
     * Adds one record at the given source position.
     *
     * @return batches completed by this call, in order: none, one, or two when a byte cut
     * and a count cut happen together
     */
    public List<Batch> add(MappedRecord record, Watermark position) {
        List<Batch> completed = Collections.emptyList();
        long recordBytes = maxBytes > 0 ? serializedSize(record) : 0;

        if (maxBytes > 0 && !pending.isEmpty() && pendingBytes + 1 + recordBytes > maxBytes) {
            completed = new ArrayList<>(2);
            completed.add(cut());
        }

        if (pending.isEmpty()) {
            firstPosition = position;
            pendingBytes = ENVELOPE_BYTES + recordBytes;
        } else {
            pendingBytes += 1 + recordBytes;
        }
        pending.add(record);
        lastPosition = position;
        maxPosition = Watermark.max(maxPosition, position);

        boolean full = pending.size() >= maxRecords;
        boolean oversize = maxBytes > 0 && pendingBytes > maxBytes;
        if (full || oversize) {
            if (completed.isEmpty()) {
                completed = new ArrayList<>(1);
            }
            completed.add(cut());
        }
        return completed;
    }

    /**
     * Emits the partial batch at end of stream, if any.
     */
    public List<Batch> flush() {
        return pending.isEmpty() ? Collections.emptyList() : List.of(cut());
    }

    /** Batches emitted so far. */
    public long batchCount() {
        return nextSequence - 1;
    }

    private Batch cut() {
        Batch batch = new Batch(nextSequence++, pending, firstPosition, lastPosition, maxPosition);
        pending.clear();
        firstPosition = null;
        lastPosition = null;
        maxPosition = null;
        pendingBytes = 0;
        return batch;
    }

    private long serializedSize(MappedRecord record) {
        try {
            return objectMapper.writeValueAsBytes(record).length;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + record.getTransactionId(), e);
        }
    }
}
