package io.partiscan.config;

public record ProbeRetryPolicy(int maxAttempts, long baseBackoffMs, long maxBackoffMs) {
    public ProbeRetryPolicy {
        maxAttempts = Math.max(1, maxAttempts);
        baseBackoffMs = Math.max(0L, baseBackoffMs);
        maxBackoffMs = Math.max(baseBackoffMs, maxBackoffMs);
    }

    public static ProbeRetryPolicy defaults() {
        return new ProbeRetryPolicy(
                PartiscanConfig.DEFAULT_PROBE_MAX_ATTEMPTS,
                PartiscanConfig.DEFAULT_PROBE_BASE_BACKOFF_MS,
                PartiscanConfig.DEFAULT_PROBE_MAX_BACKOFF_MS
        );
    }

    public static ProbeRetryPolicy noBackoff(int maxAttempts) {
        return new ProbeRetryPolicy(maxAttempts, 0L, 0L);
    }

    /**
     * Delay before the retry that follows failed attempt {@code attempt} (1-based).
     */
    public long backoffMs(int attempt) {
        int shift = Math.min(30, Math.max(0, attempt - 1));
        long raw = baseBackoffMs * (1L << shift);
        if (raw < 0L || raw > maxBackoffMs) {
            return maxBackoffMs;
        }
        return raw;
    }
}
