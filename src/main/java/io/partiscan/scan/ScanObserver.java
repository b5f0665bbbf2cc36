package io.partiscan.scan;

public interface ScanObserver {
    ScanObserver NOOP = new ScanObserver() {
    };

    default void onProbeRetry(long minValue, long maxValue, int attempt, Exception error) {
    }

    default void onBisect(long minValue, long maxValue, long count) {
    }
}
