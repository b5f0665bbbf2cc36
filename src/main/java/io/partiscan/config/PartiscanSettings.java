package io.partiscan.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.partiscan.model.ScanConfig;
import io.partiscan.model.ScanMode;
import io.partiscan.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Effective settings resolved from {@code partiscan-settings.json} on top of the built-in defaults.
 * Every value read from the file is sanitized; a missing file yields {@link #defaults()}.
 */
public record PartiscanSettings(
        ScanMode mode,
        long minValue,
        long maxValue,
        int maxWorkers,
        long denseZoneThreshold,
        long denseZoneStep,
        long initialStep,
        long maxStep,
        long maxTotalRecords,
        long saturationThreshold,
        long minBisectWidth,
        long minRecordsPerWorker,
        long targetRecordsPerChunk,
        int maxApiCalls,
        int probeMaxAttempts,
        long probeBaseBackoffMs,
        long probeMaxBackoffMs,
        int pageLimit
) {
    public static PartiscanSettings defaults() {
        return new PartiscanSettings(
                ScanMode.SINGLE_PASS,
                PartiscanConfig.DEFAULT_MIN_VALUE,
                PartiscanConfig.DEFAULT_MAX_VALUE,
                PartiscanConfig.DEFAULT_MAX_WORKERS,
                PartiscanConfig.DEFAULT_DENSE_ZONE_THRESHOLD,
                PartiscanConfig.DEFAULT_DENSE_ZONE_STEP,
                PartiscanConfig.DEFAULT_INITIAL_STEP,
                PartiscanConfig.DEFAULT_MAX_STEP,
                0L,
                PartiscanConfig.DEFAULT_SATURATION_THRESHOLD,
                PartiscanConfig.DEFAULT_MIN_BISECT_WIDTH,
                PartiscanConfig.DEFAULT_MIN_RECORDS_PER_WORKER,
                PartiscanConfig.DEFAULT_TARGET_RECORDS_PER_CHUNK,
                0,
                PartiscanConfig.DEFAULT_PROBE_MAX_ATTEMPTS,
                PartiscanConfig.DEFAULT_PROBE_BASE_BACKOFF_MS,
                PartiscanConfig.DEFAULT_PROBE_MAX_BACKOFF_MS,
                PartiscanConfig.DEFAULT_PAGE_LIMIT
        );
    }

    public static PartiscanSettings load(Path settingsFile) {
        PartiscanSettings defaults = defaults();
        if (settingsFile == null || !Files.isRegularFile(settingsFile)) {
            return defaults;
        }
        try {
            SettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
            return fromFile(file, defaults);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read settings file: " + settingsFile, e);
        }
    }

    static PartiscanSettings fromFile(SettingsFile file, PartiscanSettings defaults) {
        if (file == null) {
            return defaults;
        }
        ScanMode mode = sanitizeMode(file.mode(), defaults.mode());
        long minValue = file.minValue() == null ? defaults.minValue() : file.minValue();
        long maxValue = sanitizeLong(file.maxValue(), defaults.maxValue(), minValue + 1L);
        int maxWorkers = sanitizeInt(file.maxWorkers(), defaults.maxWorkers(), 1);
        long denseZoneThreshold = file.denseZoneThreshold() == null
                ? defaults.denseZoneThreshold()
                : file.denseZoneThreshold();
        long denseZoneStep = sanitizeLong(file.denseZoneStep(), defaults.denseZoneStep(), 1L);
        long initialStep = sanitizeLong(file.initialStep(), defaults.initialStep(), denseZoneStep + 1L);
        long maxStep = sanitizeLong(file.maxStep(), defaults.maxStep(), initialStep);
        long maxTotalRecords = sanitizeLong(file.maxTotalRecords(), defaults.maxTotalRecords(), 0L);
        long saturationThreshold = sanitizeLong(file.saturationThreshold(), defaults.saturationThreshold(), 1L);
        long minBisectWidth = sanitizeLong(file.minBisectWidth(), defaults.minBisectWidth(), 1L);
        long minRecordsPerWorker = sanitizeLong(file.minRecordsPerWorker(), defaults.minRecordsPerWorker(), 1L);
        long targetRecordsPerChunk = sanitizeLong(file.targetRecordsPerChunk(), defaults.targetRecordsPerChunk(), 0L);
        int maxApiCalls = sanitizeInt(file.maxApiCalls(), defaults.maxApiCalls(), 0);
        int probeMaxAttempts = sanitizeInt(file.probeMaxAttempts(), defaults.probeMaxAttempts(), 1);
        long probeBaseBackoffMs = sanitizeLong(file.probeBaseBackoffMs(), defaults.probeBaseBackoffMs(), 0L);
        long probeMaxBackoffMs = sanitizeLong(file.probeMaxBackoffMs(), defaults.probeMaxBackoffMs(), probeBaseBackoffMs);
        int pageLimit = sanitizeInt(file.pageLimit(), defaults.pageLimit(), 1);
        return new PartiscanSettings(
                mode,
                minValue,
                maxValue,
                maxWorkers,
                denseZoneThreshold,
                denseZoneStep,
                initialStep,
                maxStep,
                maxTotalRecords,
                saturationThreshold,
                minBisectWidth,
                minRecordsPerWorker,
                targetRecordsPerChunk,
                maxApiCalls,
                probeMaxAttempts,
                probeBaseBackoffMs,
                probeMaxBackoffMs,
                pageLimit
        );
    }

    public ScanConfig baseScanConfig() {
        return ScanConfig.builder()
                .mode(mode)
                .minValue(minValue)
                .maxValue(maxValue)
                .maxWorkers(maxWorkers)
                .denseZoneThreshold(denseZoneThreshold)
                .denseZoneStep(denseZoneStep)
                .initialStep(initialStep)
                .maxStep(maxStep)
                .maxTotalRecords(maxTotalRecords)
                .saturationThreshold(saturationThreshold)
                .minBisectWidth(minBisectWidth)
                .minRecordsPerWorker(minRecordsPerWorker)
                .targetRecordsPerChunk(targetRecordsPerChunk)
                .maxApiCalls(maxApiCalls)
                .build();
    }

    public ProbeRetryPolicy probeRetryPolicy() {
        return new ProbeRetryPolicy(probeMaxAttempts, probeBaseBackoffMs, probeMaxBackoffMs);
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static ScanMode sanitizeMode(String raw, ScanMode fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return ScanMode.fromString(raw);
        } catch (IllegalArgumentException unknownMode) {
            return fallback;
        }
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return Math.max(min, fallback);
        }
        return Math.max(min, raw);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            String mode,
            Long minValue,
            Long maxValue,
            Integer maxWorkers,
            Long denseZoneThreshold,
            Long denseZoneStep,
            Long initialStep,
            Long maxStep,
            Long maxTotalRecords,
            Long saturationThreshold,
            Long minBisectWidth,
            Long minRecordsPerWorker,
            Long targetRecordsPerChunk,
            Integer maxApiCalls,
            Integer probeMaxAttempts,
            Long probeBaseBackoffMs,
            Long probeMaxBackoffMs,
            Integer pageLimit
    ) {
    }
}
