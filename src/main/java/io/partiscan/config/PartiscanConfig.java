package io.partiscan.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class PartiscanConfig {
    public static final String DEFAULT_FEED = "default";
    public static final String SETTINGS_FILE = "partiscan-settings.json";

    public static final long DEFAULT_MIN_VALUE = 0L;
    public static final long DEFAULT_MAX_VALUE = 250_000L;
    public static final long DEFAULT_DENSE_ZONE_THRESHOLD = 20_000L;
    public static final long DEFAULT_DENSE_ZONE_STEP = 100L;
    public static final long DEFAULT_INITIAL_STEP = 500L;
    public static final long DEFAULT_MAX_STEP = 100_000L;
    public static final int DEFAULT_MAX_WORKERS = 1_000;
    public static final long DEFAULT_MIN_RECORDS_PER_WORKER = 1_000L;
    public static final long DEFAULT_TARGET_RECORDS_PER_CHUNK = 0L;
    public static final long DEFAULT_SATURATION_THRESHOLD = 5_000L;
    public static final long DEFAULT_MIN_BISECT_WIDTH = 1L;

    public static final long PREVIEW_MAX_VALUE = 100_000L;
    public static final long PREVIEW_DENSE_ZONE_STEP = 500L;
    public static final long PREVIEW_INITIAL_STEP = 5_000L;
    public static final int PREVIEW_MAX_WORKERS = 10;

    public static final int DEFAULT_PROBE_MAX_ATTEMPTS = 5;
    public static final long DEFAULT_PROBE_BASE_BACKOFF_MS = 2_000L;
    public static final long DEFAULT_PROBE_MAX_BACKOFF_MS = 32_000L;
    public static final int DEFAULT_PAGE_LIMIT = 30;

    private final Path rootDir;
    private final String feed;

    public PartiscanConfig(Path rootDir, String feed) {
        this.rootDir = rootDir;
        this.feed = feed;
    }

    public static PartiscanConfig fromRoot(String root) {
        return fromRoot(root, DEFAULT_FEED);
    }

    public static PartiscanConfig fromRoot(String root, String feed) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        return new PartiscanConfig(resolved.toAbsolutePath().normalize(), sanitizeFeed(feed));
    }

    static String sanitizeFeed(String raw) {
        String normalized = raw == null || raw.isBlank() ? DEFAULT_FEED : raw.trim().toLowerCase();
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '-');
        }
        String value = sb.toString();
        while (value.contains("--")) {
            value = value.replace("--", "-");
        }
        if (value.isBlank() || "-".equals(value)) {
            return DEFAULT_FEED;
        }
        return value;
    }

    public Path rootDir() {
        return rootDir;
    }

    public String feed() {
        return feed;
    }

    public Path dbFile() {
        return rootDir.resolve("partiscan.db");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }
}
