package com.example.revenuesync.model;

import com.example.revenuesync.dto.MappedRecord;

import java.util.List;

/**
 * Ordered group of mapped records sent in one webhook call and committed as one unit.
 *
 * @param sequence      1-based index within the run
 * @param records       records in source order
 * @param firstPosition source position of the first record
 * @param lastPosition  source position of the last record
 * @param maxPosition   highest (change column, key) position among the records
 */
public record Batch(long sequence,
                    List<MappedRecord> records,
                    Watermark firstPosition,
                    Watermark lastPosition,
                    Watermark maxPosition) {

    public Batch {
        records = List.copyOf(records);
    }

    public int size() {
        return records.size();
    }

    public BatchRange range() {
        return new BatchRange(sequence, firstPosition.key(), lastPosition.key(), records.size());
    }
}
