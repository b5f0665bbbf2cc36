package io.partiscan.model;

public enum ScanMode {
    SINGLE_PASS("single-pass"),
    TWO_PASS("two-pass");

    private final String label;

    ScanMode(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static ScanMode fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return SINGLE_PASS;
        }
        String normalized = raw.trim().replace('_', '-');
        for (ScanMode value : values()) {
            if (value.label.equalsIgnoreCase(normalized) || value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown scan mode: " + raw);
    }
}
