package io.partiscan.model;

/**
 * Most recent run and preview scan recorded for one feed. Either side is null
 * until a scan of that type has completed.
 */
public record ScanHistory(String feed, ScanRecord run, ScanRecord preview) {
}
