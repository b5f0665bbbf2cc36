package io.partiscan.storage;

import io.partiscan.model.ScanRecord;
import io.partiscan.model.ScanType;

import java.util.Optional;

/**
 * Most recent scan per {@code (feed, scanType)}; a later record replaces an earlier one.
 */
public interface ScanHistoryStore {

    void record(ScanRecord record);

    Optional<ScanRecord> latest(String feed, ScanType scanType);
}
