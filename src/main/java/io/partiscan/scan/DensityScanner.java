package io.partiscan.scan;

import io.partiscan.config.ProbeRetryPolicy;
import io.partiscan.model.DensityChunk;
import io.partiscan.model.ScanConfig;
import io.partiscan.model.ScanStats;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Builds a density map over {@code [minValue, maxValue)} with a bounded number of count probes.
 *
 * <p>Probes run strictly one after another: every chunk boundary depends on the previous result.
 * The map is always contiguous and gapless, empty ranges included.
 */
public final class DensityScanner {
    private static final long SPARSE_ZOOM_FACTOR = 5L;

    private final RangeCounter counter;
    private final ProbeRetryPolicy retryPolicy;
    private final ScanObserver observer;

    public DensityScanner(RangeCounter counter) {
        this(counter, ProbeRetryPolicy.defaults(), ScanObserver.NOOP);
    }

    public DensityScanner(RangeCounter counter, ProbeRetryPolicy retryPolicy, ScanObserver observer) {
        if (counter == null) {
            throw new IllegalArgumentException("counter must not be null");
        }
        this.counter = counter;
        this.retryPolicy = retryPolicy == null ? ProbeRetryPolicy.defaults() : retryPolicy;
        this.observer = observer == null ? ScanObserver.NOOP : observer;
    }

    public DensityScan scan(ScanConfig config) {
        long startedNs = System.nanoTime();
        ScanContext ctx = new ScanContext(config);
        List<DensityChunk> densityMap = new ArrayList<>();
        long position = config.minValue();
        long sparseStep = config.initialStep();

        while (position < config.maxValue()) {
            boolean dense = position < config.denseZoneThreshold();
            long end = saturatingAdd(position, dense ? config.denseZoneStep() : sparseStep);
            if (dense) {
                end = Math.min(end, config.denseZoneThreshold());
            }
            end = Math.min(end, config.maxValue());

            long count = probe(ctx, position, end);
            ctx.rangesScanned++;
            if (config.twoPass() && count > config.saturationThreshold() && end - position > config.minBisectWidth()) {
                densityMap.addAll(bisect(ctx, position, end, count));
            } else {
                densityMap.add(new DensityChunk(position, end, count));
            }

            if (!dense && config.targetRecordsPerChunk() > 0) {
                sparseStep = adaptSparseStep(config, sparseStep, count);
            }
            position = end;
        }

        long total = 0L;
        int nonEmpty = 0;
        for (DensityChunk chunk : densityMap) {
            total += chunk.count();
            if (chunk.count() > 0) {
                nonEmpty++;
            }
        }
        long durationMs = (System.nanoTime() - startedNs) / 1_000_000L;
        ScanStats stats = new ScanStats(
                ctx.apiCalls,
                durationMs,
                ctx.rangesScanned,
                nonEmpty,
                ctx.bisections > 0,
                ctx.bisections,
                ctx.retries,
                total,
                false
        );
        return new DensityScan(densityMap, stats);
    }

    /**
     * Splits a saturated range at its midpoint until every piece is under the saturation
     * threshold or no wider than {@code minBisectWidth}. Only the left half is probed; the
     * right half's count is the parent's count minus the left's.
     */
    private List<DensityChunk> bisect(ScanContext ctx, long min, long max, long count) {
        ScanConfig config = ctx.config;
        List<DensityChunk> out = new ArrayList<>();
        Deque<PendingRange> worklist = new ArrayDeque<>();
        worklist.push(new PendingRange(min, max, count));
        while (!worklist.isEmpty()) {
            PendingRange range = worklist.pop();
            long width = range.max() - range.min();
            if (range.count() <= config.saturationThreshold() || width <= config.minBisectWidth()) {
                out.add(new DensityChunk(range.min(), range.max(), range.count()));
                continue;
            }
            ctx.bisections++;
            observer.onBisect(range.min(), range.max(), range.count());
            long mid = range.min() + width / 2L;
            long left = probe(ctx, range.min(), mid);
            long right = Math.max(0L, range.count() - left);
            // Stack order keeps the output ascending.
            worklist.push(new PendingRange(mid, range.max(), right));
            worklist.push(new PendingRange(range.min(), mid, left));
        }
        return out;
    }

    private long probe(ScanContext ctx, long min, long max) {
        ScanConfig config = ctx.config;
        if (config.maxApiCalls() > 0 && ctx.apiCalls >= config.maxApiCalls()) {
            throw ScanException.budgetExhausted(min, max, config.maxApiCalls());
        }
        ctx.apiCalls++;
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                long count = counter.count(min, max);
                if (count < 0) {
                    throw new IllegalStateException("count probe returned negative count " + count);
                }
                return count;
            } catch (IOException | RuntimeException e) {
                if (attempt >= retryPolicy.maxAttempts()) {
                    throw ScanException.probeFailed(min, max, attempt, e);
                }
                ctx.retries++;
                observer.onProbeRetry(min, max, attempt, e);
                sleepBackoff(min, max, attempt);
            }
        }
    }

    private void sleepBackoff(long min, long max, int attempt) {
        long delayMs = retryPolicy.backoffMs(attempt);
        if (delayMs <= 0L) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScanException("Interrupted while backing off", min, max, attempt, e);
        }
    }

    static long adaptSparseStep(ScanConfig config, long step, long count) {
        long floor = Math.min(config.maxStep(), config.denseZoneStep() * 2L);
        if (count == 0L) {
            return Math.min(config.maxStep(), saturatingMultiply(step, SPARSE_ZOOM_FACTOR));
        }
        double ratio = (double) config.targetRecordsPerChunk() / (double) count;
        long next = (long) Math.floor(step * ratio);
        return Math.max(floor, Math.min(next, config.maxStep()));
    }

    private static long saturatingAdd(long a, long b) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException overflow) {
            return Long.MAX_VALUE;
        }
    }

    private static long saturatingMultiply(long a, long b) {
        try {
            return Math.multiplyExact(a, b);
        } catch (ArithmeticException overflow) {
            return Long.MAX_VALUE;
        }
    }

    private record PendingRange(long min, long max, long count) {
    }

    private static final class ScanContext {
        private final ScanConfig config;
        private int apiCalls;
        private int rangesScanned;
        private int bisections;
        private int retries;

        private ScanContext(ScanConfig config) {
            this.config = config;
        }
    }
}
