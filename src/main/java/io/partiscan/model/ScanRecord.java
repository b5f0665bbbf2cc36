package io.partiscan.model;

public record ScanRecord(
        String feed,
        ScanType scanType,
        ScanConfig config,
        ScanResult result,
        long recordedAtMs
) {
}
