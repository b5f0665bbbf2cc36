package io.partiscan.scan;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * In-process {@link RangeCounter} over a fixed set of values, answered by binary search.
 * Used by the command line to scan a values file and by tests as a deterministic feed.
 */
public final class SortedValuesCounter implements RangeCounter {
    private final long[] sorted;
    private int queries;

    public SortedValuesCounter(long... values) {
        this.sorted = values == null ? new long[0] : values.clone();
        Arrays.sort(this.sorted);
    }

    /**
     * One integral value per line; blank lines and lines starting with {@code #} are skipped.
     */
    public static SortedValuesCounter fromFile(Path file) throws IOException {
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        long[] values = new long[lines.size()];
        int n = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            try {
                values[n++] = Long.parseLong(line);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        "Invalid value at " + file + ":" + (i + 1) + ": '" + line + "'", e
                );
            }
        }
        return new SortedValuesCounter(Arrays.copyOf(values, n));
    }

    @Override
    public synchronized long count(long minInclusive, long maxExclusive) {
        queries++;
        if (maxExclusive <= minInclusive) {
            return 0L;
        }
        return lowerBound(maxExclusive) - lowerBound(minInclusive);
    }

    public int size() {
        return sorted.length;
    }

    public synchronized int queries() {
        return queries;
    }

    private int lowerBound(long value) {
        int lo = 0;
        int hi = sorted.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (sorted[mid] < value) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }
}
