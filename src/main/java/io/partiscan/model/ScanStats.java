package io.partiscan.model;

public record ScanStats(
        int apiCalls,
        long scanDurationMs,
        int rangesScanned,
        int nonEmptyRanges,
        boolean usedTwoPass,
        int bisections,
        int retries,
        long scannedRecords,
        boolean capped
) {
    public ScanStats withPlanning(long scannedRecords, boolean capped) {
        return new ScanStats(
                apiCalls,
                scanDurationMs,
                rangesScanned,
                nonEmptyRanges,
                usedTwoPass,
                bisections,
                retries,
                scannedRecords,
                capped
        );
    }
}
