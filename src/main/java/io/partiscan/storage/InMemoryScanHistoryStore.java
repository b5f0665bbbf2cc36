package io.partiscan.storage;

import io.partiscan.model.ScanRecord;
import io.partiscan.model.ScanType;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public final class InMemoryScanHistoryStore implements ScanHistoryStore {
    private final ConcurrentMap<String, ScanRecord> records = new ConcurrentHashMap<>();

    @Override
    public void record(ScanRecord record) {
        records.put(key(record.feed(), record.scanType()), record);
    }

    @Override
    public Optional<ScanRecord> latest(String feed, ScanType scanType) {
        return Optional.ofNullable(records.get(key(feed, scanType)));
    }

    private static String key(String feed, ScanType scanType) {
        return feed + ":" + scanType.storageKey();
    }
}
