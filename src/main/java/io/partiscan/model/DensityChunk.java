package io.partiscan.model;

/**
 * Record count observed in the half-open value range {@code [minValue, maxValue)}.
 */
public record DensityChunk(long minValue, long maxValue, long count) {
    public DensityChunk {
        if (maxValue <= minValue) {
            throw new IllegalArgumentException("chunk range must be non-empty: [" + minValue + ", " + maxValue + ")");
        }
        if (count < 0) {
            throw new IllegalArgumentException("chunk count must be >= 0, got " + count);
        }
    }

    public long width() {
        return maxValue - minValue;
    }
}
