package com.example.revenuesync.model;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.Objects;

/**
 * Position in the source table ordered by (change column, primary key).
 *
 * Two rows sharing the same change timestamp are told apart by their key, which
 * gives incremental extraction a stable resume point.
 */
public record Watermark(LocalDateTime changedAt, long key) implements Comparable<Watermark> {

    private static final Comparator<Watermark> ORDER = Comparator
            .comparing(Watermark::changedAt)
            .thenComparingLong(Watermark::key);

    public Watermark {
        Objects.requireNonNull(changedAt, "changedAt must not be null");
    }

    public static Watermark of(LocalDateTime changedAt, long key) {
        return new Watermark(changedAt, key);
    }

    /**
     * Null-safe maximum of two positions.
     */
    public static Watermark max(Watermark a, Watermark b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.compareTo(b) >= 0 ? a : b;
    }

    public boolean isAfter(Watermark other) {
        return other == null || compareTo(other) > 0;
    }

    @Override
    public int compareTo(Watermark other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return changedAt + "#" + key;
    }
}
