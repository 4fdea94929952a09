package com.example.revenuesync.model;

/**
 * Source key range covered by a batch, used to report failed batches.
 */
public record BatchRange(long sequence, long firstKey, long lastKey, int recordCount) {

    @Override
    public String toString() {
        return "batch " + sequence + " [TJ" + firstKey + "..TJ" + lastKey + ", " + recordCount + " records]";
    }
}
