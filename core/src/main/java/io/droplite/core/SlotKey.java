package io.droplite.core;

import java.util.Objects;

/**
 * Identifies one distribution batch: (day, category, subBatch).
 * subBatch is 0 unless a day's entries for a category exceeded one tree.
 */
public record SlotKey(long day, Category category, int subBatch) {

    public static final long SECONDS_PER_DAY = 86_400L;

    public SlotKey {
        Objects.requireNonNull(category, "category");
        if (day < 0) throw new IllegalArgumentException("day must be >= 0");
        if (subBatch < 0 || subBatch > 0xFFFF) throw new IllegalArgumentException("subBatch out of range: " + subBatch);
    }

    public static SlotKey of(long day, Category category) {
        return new SlotKey(day, category, 0);
    }

    public static long dayOf(long epochSeconds) {
        return Math.floorDiv(epochSeconds, SECONDS_PER_DAY);
    }

    @Override
    public String toString() {
        return day + "/" + category + "/" + subBatch;
    }
}
