package io.partiscan.model;

import io.partiscan.config.PartiscanConfig;

/**
 * Parameters for one density scan and the partition plan built from it.
 *
 * <p>Values are integral price units. The dense zone is {@code [minValue, denseZoneThreshold)}
 * and is probed with {@code denseZoneStep}; everything above it starts at {@code initialStep}.
 * {@code saturationThreshold} and {@code minBisectWidth} only matter in {@link ScanMode#TWO_PASS}.
 * Zero means unlimited for {@code maxTotalRecords} and {@code maxApiCalls}, and fixed sparse
 * stepping for {@code targetRecordsPerChunk}.
 */
public record ScanConfig(
        ScanMode mode,
        long minValue,
        long maxValue,
        int maxWorkers,
        long denseZoneThreshold,
        long denseZoneStep,
        long initialStep,
        long maxTotalRecords,
        long saturationThreshold,
        long minBisectWidth,
        long minRecordsPerWorker,
        long targetRecordsPerChunk,
        long maxStep,
        int maxApiCalls
) {
    public ScanConfig {
        mode = mode == null ? ScanMode.SINGLE_PASS : mode;
        if (minValue >= maxValue) {
            throw new IllegalArgumentException("minValue must be < maxValue, got [" + minValue + ", " + maxValue + ")");
        }
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be >= 1, got " + maxWorkers);
        }
        if (denseZoneStep <= 0 || initialStep <= 0) {
            throw new IllegalArgumentException("step sizes must be > 0");
        }
        if (denseZoneStep >= initialStep) {
            throw new IllegalArgumentException(
                    "denseZoneStep must be < initialStep, got denseZoneStep=" + denseZoneStep + ", initialStep=" + initialStep
            );
        }
        if (maxTotalRecords < 0) {
            throw new IllegalArgumentException("maxTotalRecords must be >= 0, got " + maxTotalRecords);
        }
        if (saturationThreshold < 1) {
            throw new IllegalArgumentException("saturationThreshold must be >= 1, got " + saturationThreshold);
        }
        if (minBisectWidth < 1) {
            throw new IllegalArgumentException("minBisectWidth must be >= 1, got " + minBisectWidth);
        }
        if (minRecordsPerWorker < 1) {
            throw new IllegalArgumentException("minRecordsPerWorker must be >= 1, got " + minRecordsPerWorker);
        }
        if (targetRecordsPerChunk < 0) {
            throw new IllegalArgumentException("targetRecordsPerChunk must be >= 0, got " + targetRecordsPerChunk);
        }
        if (maxStep < initialStep) {
            throw new IllegalArgumentException("maxStep must be >= initialStep, got " + maxStep);
        }
        if (maxApiCalls < 0) {
            throw new IllegalArgumentException("maxApiCalls must be >= 0, got " + maxApiCalls);
        }
    }

    public static ScanConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .mode(mode)
                .minValue(minValue)
                .maxValue(maxValue)
                .maxWorkers(maxWorkers)
                .denseZoneThreshold(denseZoneThreshold)
                .denseZoneStep(denseZoneStep)
                .initialStep(initialStep)
                .maxTotalRecords(maxTotalRecords)
                .saturationThreshold(saturationThreshold)
                .minBisectWidth(minBisectWidth)
                .minRecordsPerWorker(minRecordsPerWorker)
                .targetRecordsPerChunk(targetRecordsPerChunk)
                .maxStep(maxStep)
                .maxApiCalls(maxApiCalls);
    }

    public boolean twoPass() {
        return mode == ScanMode.TWO_PASS;
    }

    public static final class Builder {
        private ScanMode mode = ScanMode.SINGLE_PASS;
        private long minValue = PartiscanConfig.DEFAULT_MIN_VALUE;
        private long maxValue = PartiscanConfig.DEFAULT_MAX_VALUE;
        private int maxWorkers = PartiscanConfig.DEFAULT_MAX_WORKERS;
        private long denseZoneThreshold = PartiscanConfig.DEFAULT_DENSE_ZONE_THRESHOLD;
        private long denseZoneStep = PartiscanConfig.DEFAULT_DENSE_ZONE_STEP;
        private long initialStep = PartiscanConfig.DEFAULT_INITIAL_STEP;
        private long maxTotalRecords = 0L;
        private long saturationThreshold = PartiscanConfig.DEFAULT_SATURATION_THRESHOLD;
        private long minBisectWidth = PartiscanConfig.DEFAULT_MIN_BISECT_WIDTH;
        private long minRecordsPerWorker = PartiscanConfig.DEFAULT_MIN_RECORDS_PER_WORKER;
        private long targetRecordsPerChunk = PartiscanConfig.DEFAULT_TARGET_RECORDS_PER_CHUNK;
        private long maxStep = PartiscanConfig.DEFAULT_MAX_STEP;
        private int maxApiCalls = 0;

        private Builder() {
        }

        public Builder mode(ScanMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder minValue(long minValue) {
            this.minValue = minValue;
            return this;
        }

        public Builder maxValue(long maxValue) {
            this.maxValue = maxValue;
            return this;
        }

        public Builder maxWorkers(int maxWorkers) {
            this.maxWorkers = maxWorkers;
            return this;
        }

        public Builder denseZoneThreshold(long denseZoneThreshold) {
            this.denseZoneThreshold = denseZoneThreshold;
            return this;
        }

        public Builder denseZoneStep(long denseZoneStep) {
            this.denseZoneStep = denseZoneStep;
            return this;
        }

        public Builder initialStep(long initialStep) {
            this.initialStep = initialStep;
            return this;
        }

        public Builder maxTotalRecords(long maxTotalRecords) {
            this.maxTotalRecords = maxTotalRecords;
            return this;
        }

        public Builder saturationThreshold(long saturationThreshold) {
            this.saturationThreshold = saturationThreshold;
            return this;
        }

        public Builder minBisectWidth(long minBisectWidth) {
            this.minBisectWidth = minBisectWidth;
            return this;
        }

        public Builder minRecordsPerWorker(long minRecordsPerWorker) {
            this.minRecordsPerWorker = minRecordsPerWorker;
            return this;
        }

        public Builder targetRecordsPerChunk(long targetRecordsPerChunk) {
            this.targetRecordsPerChunk = targetRecordsPerChunk;
            return this;
        }

        public Builder maxStep(long maxStep) {
            this.maxStep = maxStep;
            return this;
        }

        public Builder maxApiCalls(int maxApiCalls) {
            this.maxApiCalls = maxApiCalls;
            return this;
        }

        public ScanConfig build() {
            return new ScanConfig(
                    mode,
                    minValue,
                    maxValue,
                    maxWorkers,
                    denseZoneThreshold,
                    denseZoneStep,
                    initialStep,
                    maxTotalRecords,
                    saturationThreshold,
                    minBisectWidth,
                    minRecordsPerWorker,
                    targetRecordsPerChunk,
                    Math.max(maxStep, initialStep),
                    maxApiCalls
            );
        }
    }
}
