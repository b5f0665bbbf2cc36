package io.partiscan.model;

public enum ScanType {
    RUN("run"),
    PREVIEW("preview");

    private final String storageKey;

    ScanType(String storageKey) {
        this.storageKey = storageKey;
    }

    public String storageKey() {
        return storageKey;
    }

    public static ScanType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("scan type must not be blank");
        }
        for (ScanType value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim()) || value.storageKey.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown scan type: " + raw);
    }
}
