package io.partiscan.scan;

import io.partiscan.config.ProbeRetryPolicy;
import io.partiscan.model.DensityChunk;
import io.partiscan.model.ScanConfig;
import io.partiscan.model.ScanMode;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

final class DensityScannerTest {

    private static ScanConfig.Builder smallConfig() {
        return ScanConfig.builder()
                .minValue(0L)
                .maxValue(1_000L)
                .denseZoneThreshold(200L)
                .denseZoneStep(50L)
                .initialStep(100L)
                .maxWorkers(4)
                .minRecordsPerWorker(1L);
    }

    private static SortedValuesCounter spreadValues() {
        long[] values = new long[300];
        for (int i = 0; i < values.length; i++) {
            values[i] = i < 200 ? i : 200L + (i - 200L) * 8L;
        }
        return new SortedValuesCounter(values);
    }

    @Test
    void densityMapIsGaplessAndCoversEveryRecord() {
        SortedValuesCounter counter = spreadValues();
        DensityScan scan = new DensityScanner(counter).scan(smallConfig().build());

        List<DensityChunk> map = scan.densityMap();
        Assertions.assertEquals(0L, map.get(0).minValue());
        Assertions.assertEquals(1_000L, map.get(map.size() - 1).maxValue());
        for (int i = 1; i < map.size(); i++) {
            Assertions.assertEquals(map.get(i - 1).maxValue(), map.get(i).minValue());
        }
        Assertions.assertEquals(300L, scan.totalRecords());
        Assertions.assertEquals(300L, scan.stats().scannedRecords());
    }

    @Test
    void denseZoneUsesFineStepsAndSparseZoneUsesInitialStep() {
        DensityScan scan = new DensityScanner(spreadValues()).scan(smallConfig().build());

        List<DensityChunk> map = scan.densityMap();
        Assertions.assertEquals(12, map.size());
        Assertions.assertEquals(new DensityChunk(0L, 50L, 50L), map.get(0));
        Assertions.assertEquals(new DensityChunk(150L, 200L, 50L), map.get(3));
        Assertions.assertEquals(100L, map.get(4).width());
        Assertions.assertEquals(12, scan.stats().apiCalls());
        Assertions.assertEquals(12, scan.stats().rangesScanned());
        Assertions.assertFalse(scan.stats().usedTwoPass());
    }

    @Test
    void probesAreClampedToThresholdAndUpperBound() {
        ScanConfig config = smallConfig().denseZoneThreshold(120L).maxValue(1_030L).build();
        DensityScan scan = new DensityScanner(new SortedValuesCounter()).scan(config);

        List<DensityChunk> map = scan.densityMap();
        Assertions.assertEquals(new DensityChunk(100L, 120L, 0L), map.get(2));
        Assertions.assertEquals(120L, map.get(3).minValue());
        Assertions.assertEquals(1_030L, map.get(map.size() - 1).maxValue());
        Assertions.assertEquals(0L, scan.totalRecords());
        Assertions.assertEquals(0, scan.stats().nonEmptyRanges());
    }

    @Test
    void twoPassBisectsSaturatedRangesOnlyProbingLeftHalves() {
        long[] values = new long[100];
        java.util.Arrays.fill(values, 5L);
        ScanConfig config = ScanConfig.builder()
                .mode(ScanMode.TWO_PASS)
                .minValue(0L)
                .maxValue(10L)
                .denseZoneThreshold(0L)
                .denseZoneStep(1L)
                .initialStep(10L)
                .saturationThreshold(10L)
                .minBisectWidth(1L)
                .build();
        SortedValuesCounter counter = new SortedValuesCounter(values);

        DensityScan scan = new DensityScanner(counter).scan(config);

        Assertions.assertEquals(List.of(
                new DensityChunk(0L, 5L, 0L),
                new DensityChunk(5L, 6L, 100L),
                new DensityChunk(6L, 7L, 0L),
                new DensityChunk(7L, 10L, 0L)
        ), scan.densityMap());
        Assertions.assertEquals(4, scan.stats().apiCalls());
        Assertions.assertEquals(4, counter.queries());
        Assertions.assertEquals(3, scan.stats().bisections());
        Assertions.assertTrue(scan.stats().usedTwoPass());
        Assertions.assertEquals(1, scan.stats().rangesScanned());
    }

    @Test
    void singlePassNeverBisects() {
        long[] values = new long[100];
        java.util.Arrays.fill(values, 5L);
        ScanConfig config = ScanConfig.builder()
                .minValue(0L)
                .maxValue(10L)
                .denseZoneThreshold(0L)
                .denseZoneStep(1L)
                .initialStep(10L)
                .saturationThreshold(10L)
                .build();

        DensityScan scan = new DensityScanner(new SortedValuesCounter(values)).scan(config);

        Assertions.assertEquals(List.of(new DensityChunk(0L, 10L, 100L)), scan.densityMap());
        Assertions.assertEquals(0, scan.stats().bisections());
    }

    @Test
    void transientProbeFailuresAreRetried() {
        SortedValuesCounter values = spreadValues();
        AtomicInteger failuresLeft = new AtomicInteger(2);
        RangeCounter flaky = (min, max) -> {
            if (failuresLeft.getAndDecrement() > 0) {
                throw new IOException("upstream timeout");
            }
            return values.count(min, max);
        };
        List<Integer> retryAttempts = new ArrayList<>();
        ScanObserver observer = new ScanObserver() {
            @Override
            public void onProbeRetry(long minValue, long maxValue, int attempt, Exception error) {
                retryAttempts.add(attempt);
            }
        };

        DensityScan scan = new DensityScanner(flaky, ProbeRetryPolicy.noBackoff(3), observer).scan(smallConfig().build());

        Assertions.assertEquals(300L, scan.totalRecords());
        Assertions.assertEquals(2, scan.stats().retries());
        Assertions.assertEquals(12, scan.stats().apiCalls());
        Assertions.assertEquals(List.of(1, 2), retryAttempts);
    }

    @Test
    void exhaustedRetriesFailTheScanWithProbeBounds() {
        RangeCounter broken = (min, max) -> {
            throw new IOException("feed unavailable");
        };
        DensityScanner scanner = new DensityScanner(broken, ProbeRetryPolicy.noBackoff(3), ScanObserver.NOOP);

        ScanException error = Assertions.assertThrows(ScanException.class, () -> scanner.scan(smallConfig().build()));

        Assertions.assertEquals(0L, error.minValue());
        Assertions.assertEquals(50L, error.maxValue());
        Assertions.assertEquals(3, error.attempts());
        Assertions.assertInstanceOf(IOException.class, error.getCause());
    }

    @Test
    void negativeCountIsTreatedAsProbeFailure() {
        RangeCounter bogus = (min, max) -> -1L;
        DensityScanner scanner = new DensityScanner(bogus, ProbeRetryPolicy.noBackoff(2), ScanObserver.NOOP);

        ScanException error = Assertions.assertThrows(ScanException.class, () -> scanner.scan(smallConfig().build()));
        Assertions.assertEquals(2, error.attempts());
    }

    @Test
    void callBudgetStopsTheScan() {
        ScanConfig config = smallConfig().maxApiCalls(5).build();
        DensityScanner scanner = new DensityScanner(spreadValues());

        ScanException error = Assertions.assertThrows(ScanException.class, () -> scanner.scan(config));
        Assertions.assertTrue(error.getMessage().contains("budget"));
    }

    @Test
    void sparseStepGrowsOnEmptyRangesAndShrinksOnDenseOnes() {
        ScanConfig config = ScanConfig.builder()
                .denseZoneStep(100L)
                .initialStep(500L)
                .maxStep(10_000L)
                .targetRecordsPerChunk(1_000L)
                .build();

        Assertions.assertEquals(2_500L, DensityScanner.adaptSparseStep(config, 500L, 0L));
        Assertions.assertEquals(10_000L, DensityScanner.adaptSparseStep(config, 5_000L, 0L));
        Assertions.assertEquals(250L, DensityScanner.adaptSparseStep(config, 500L, 2_000L));
        Assertions.assertEquals(200L, DensityScanner.adaptSparseStep(config, 500L, 1_000_000L));
        Assertions.assertEquals(10_000L, DensityScanner.adaptSparseStep(config, 500L, 10L));
    }

    @Test
    void adaptiveSparseSteppingStillCoversTheRange() {
        ScanConfig config = smallConfig().targetRecordsPerChunk(20L).maxStep(400L).build();
        DensityScan scan = new DensityScanner(spreadValues()).scan(config);

        List<DensityChunk> map = scan.densityMap();
        for (int i = 1; i < map.size(); i++) {
            Assertions.assertEquals(map.get(i - 1).maxValue(), map.get(i).minValue());
        }
        Assertions.assertEquals(1_000L, map.get(map.size() - 1).maxValue());
        Assertions.assertEquals(300L, scan.totalRecords());
    }
}
