package io.partiscan.scan;

/**
 * The scan could not produce a complete density map. No plan is available for the run.
 */
public final class ScanException extends RuntimeException {
    private final long minValue;
    private final long maxValue;
    private final int attempts;

    public ScanException(String message, long minValue, long maxValue, int attempts, Throwable cause) {
        super(message, cause);
        this.minValue = minValue;
        this.maxValue = maxValue;
        this.attempts = attempts;
    }

    public static ScanException probeFailed(long minValue, long maxValue, int attempts, Throwable cause) {
        return new ScanException(
                "Count probe failed for [" + minValue + ", " + maxValue + ") after " + attempts + " attempt(s)",
                minValue,
                maxValue,
                attempts,
                cause
        );
    }

    public static ScanException budgetExhausted(long minValue, long maxValue, int maxApiCalls) {
        return new ScanException(
                "API call budget of " + maxApiCalls + " exhausted before probing [" + minValue + ", " + maxValue + ")",
                minValue,
                maxValue,
                0,
                null
        );
    }

    public long minValue() {
        return minValue;
    }

    public long maxValue() {
        return maxValue;
    }

    public int attempts() {
        return attempts;
    }
}
