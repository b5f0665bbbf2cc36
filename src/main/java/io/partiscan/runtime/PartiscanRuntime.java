package io.partiscan.runtime;

import io.partiscan.config.PartiscanConfig;
import io.partiscan.config.PartiscanSettings;
import io.partiscan.model.Partition;
import io.partiscan.model.PartitionProgress;
import io.partiscan.model.RunProgressSummary;
import io.partiscan.model.ScanConfig;
import io.partiscan.model.ScanHistory;
import io.partiscan.model.ScanMode;
import io.partiscan.model.ScanRecord;
import io.partiscan.model.ScanResult;
import io.partiscan.model.ScanType;
import io.partiscan.model.WorkItem;
import io.partiscan.observability.AuditLogger;
import io.partiscan.plan.PartitionPlan;
import io.partiscan.plan.PartitionPlanner;
import io.partiscan.progress.PartitionProgressTracker;
import io.partiscan.progress.ProgressStore;
import io.partiscan.scan.DensityScan;
import io.partiscan.scan.DensityScanner;
import io.partiscan.scan.RangeCounter;
import io.partiscan.scan.ScanException;
import io.partiscan.scan.ScanObserver;
import io.partiscan.storage.Database;
import io.partiscan.storage.ScanHistoryStore;
import io.partiscan.storage.SqliteProgressStore;
import io.partiscan.storage.SqliteScanHistoryStore;
import io.partiscan.worker.PageContinuation;
import io.partiscan.worker.PageOutcome;
import io.partiscan.worker.PageSource;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class PartiscanRuntime {
    public static final String ACTION_SCAN_START = "scan.start";
    public static final String ACTION_SCAN_PROBE_RETRY = "scan.probe.retry";
    public static final String ACTION_SCAN_COMPLETE = "scan.complete";
    public static final String ACTION_SCAN_FAILED = "scan.failed";

    private final PartiscanConfig config;
    private final Database database;
    private final ProgressStore progressStore;
    private final ScanHistoryStore historyStore;
    private final AuditLogger auditLogger;
    private final PartitionProgressTracker tracker;
    private final PartitionPlanner planner;
    private final PageContinuation pageContinuation;
    private volatile PartiscanSettings settings;

    public PartiscanRuntime(PartiscanConfig config) {
        this.config = config;
        this.database = new Database(config);
        this.progressStore = new SqliteProgressStore(database);
        this.historyStore = new SqliteScanHistoryStore(database);
        this.auditLogger = new AuditLogger(config.auditFile(), config.feed());
        this.tracker = new PartitionProgressTracker(progressStore, auditLogger);
        this.planner = new PartitionPlanner();
        this.pageContinuation = new PageContinuation(tracker);
        this.settings = PartiscanSettings.defaults();
    }

    public void init() {
        database.init();
        reloadSettings();
    }

    public PartiscanSettings reloadSettings() {
        PartiscanSettings loaded = PartiscanSettings.load(config.settingsFile());
        this.settings = loaded;
        return loaded;
    }

    public PartiscanSettings settings() {
        return settings;
    }

    public PartiscanConfig config() {
        return config;
    }

    public PartitionProgressTracker tracker() {
        return tracker;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    public ScanResult runScan(RangeCounter counter) {
        return runScan(counter, settings.baseScanConfig());
    }

    /**
     * Full scan for a run. The result replaces the feed's previous run record.
     *
     * @throws ScanException if a probe keeps failing or the call budget runs out; nothing is recorded
     */
    public ScanResult runScan(RangeCounter counter, ScanConfig scanConfig) {
        return scanAndRecord(counter, scanConfig, ScanType.RUN);
    }

    /**
     * Cheap two-pass scan with coarse steps and few workers. Null bounds fall back to the
     * settings minimum and the preview maximum, or one coarse step past a minimum beyond it.
     */
    public ScanResult previewScan(RangeCounter counter, Long minValue, Long maxValue) {
        return scanAndRecord(counter, previewConfig(settings, minValue, maxValue), ScanType.PREVIEW);
    }

    static ScanConfig previewConfig(PartiscanSettings settings, Long minValue, Long maxValue) {
        long min = minValue == null ? settings.minValue() : minValue;
        long max = maxValue == null ? defaultPreviewMax(min) : maxValue;
        return settings.baseScanConfig().toBuilder()
                .mode(ScanMode.TWO_PASS)
                .minValue(min)
                .maxValue(max)
                .maxWorkers(PartiscanConfig.PREVIEW_MAX_WORKERS)
                .denseZoneStep(PartiscanConfig.PREVIEW_DENSE_ZONE_STEP)
                .initialStep(PartiscanConfig.PREVIEW_INITIAL_STEP)
                .build();
    }

    // A lower bound at or past the preview ceiling still gets one coarse step to scan.
    private static long defaultPreviewMax(long min) {
        if (min > Long.MAX_VALUE - PartiscanConfig.PREVIEW_INITIAL_STEP) {
            return Long.MAX_VALUE;
        }
        return Math.max(PartiscanConfig.PREVIEW_MAX_VALUE, min + PartiscanConfig.PREVIEW_INITIAL_STEP);
    }

    public ScanHistory getScanHistory() {
        return getScanHistory(config.feed());
    }

    public ScanHistory getScanHistory(String feed) {
        return new ScanHistory(
                feed,
                historyStore.latest(feed, ScanType.RUN).orElse(null),
                historyStore.latest(feed, ScanType.PREVIEW).orElse(null)
        );
    }

    /**
     * Creates a progress row per partition and returns the first page of each.
     * Calling it again for the same run is harmless: existing rows are kept.
     */
    public List<WorkItem> planWorkItems(String runId, ScanResult result, int pageLimit) {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId must not be blank");
        }
        int limit = pageLimit > 0 ? pageLimit : settings.pageLimit();
        List<WorkItem> out = new ArrayList<>();
        for (Partition partition : result.partitions()) {
            tracker.initialize(runId, partition.partitionId());
            out.add(WorkItem.first(runId, partition, limit));
        }
        return List.copyOf(out);
    }

    public PageOutcome processPage(WorkItem item, PageSource source) throws IOException {
        return pageContinuation.process(item, source);
    }

    public PartitionProgress progress(String runId, String partitionId) {
        return tracker.get(runId, partitionId);
    }

    public List<PartitionProgress> runProgress(String runId) {
        return tracker.listRun(runId);
    }

    public RunProgressSummary summarizeRun(String runId) {
        return tracker.summarize(runId);
    }

    public AuditLogger.IntegrityReport verifyAudit() {
        return auditLogger.verify();
    }

    public List<Database.SchemaMigrationRow> schemaMigrations(int limit) {
        return database.listSchemaMigrations(limit);
    }

    private ScanResult scanAndRecord(RangeCounter counter, ScanConfig scanConfig, ScanType scanType) {
        String resource = "scan/" + config.feed() + "/" + scanType.storageKey();
        Map<String, Object> startDetails = new LinkedHashMap<>();
        startDetails.put("mode", scanConfig.mode().label());
        startDetails.put("min_value", scanConfig.minValue());
        startDetails.put("max_value", scanConfig.maxValue());
        startDetails.put("max_workers", scanConfig.maxWorkers());
        auditLogger.log(AuditLogger.AuditEvent.of(ACTION_SCAN_START, resource, AuditLogger.RESULT_OK, startDetails));

        DensityScanner scanner = new DensityScanner(counter, settings.probeRetryPolicy(), new AuditingObserver(resource));
        ScanResult result;
        try {
            DensityScan scan = scanner.scan(scanConfig);
            PartitionPlan plan = planner.plan(scan.densityMap(), scanConfig);
            result = new ScanResult(
                    plan.totalRecords(),
                    plan.workerCount(),
                    scan.stats().withPlanning(plan.scannedRecords(), plan.capped()),
                    scan.densityMap(),
                    plan.partitions()
            );
        } catch (ScanException e) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("min_value", e.minValue());
            details.put("max_value", e.maxValue());
            details.put("attempts", e.attempts());
            details.put("error", e.getMessage());
            auditLogger.log(AuditLogger.AuditEvent.of(ACTION_SCAN_FAILED, resource, AuditLogger.RESULT_FAILED, details));
            throw e;
        }

        historyStore.record(new ScanRecord(config.feed(), scanType, scanConfig, result, Instant.now().toEpochMilli()));

        Map<String, Object> doneDetails = new LinkedHashMap<>();
        doneDetails.put("total_records", result.totalRecords());
        doneDetails.put("worker_count", result.workerCount());
        doneDetails.put("api_calls", result.stats().apiCalls());
        doneDetails.put("retries", result.stats().retries());
        doneDetails.put("bisections", result.stats().bisections());
        doneDetails.put("capped", result.stats().capped());
        doneDetails.put("duration_ms", result.stats().scanDurationMs());
        auditLogger.log(AuditLogger.AuditEvent.of(ACTION_SCAN_COMPLETE, resource, AuditLogger.RESULT_OK, doneDetails));
        return result;
    }

    private final class AuditingObserver implements ScanObserver {
        private final String resource;

        private AuditingObserver(String resource) {
            this.resource = resource;
        }

        @Override
        public void onProbeRetry(long minValue, long maxValue, int attempt, Exception error) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("min_value", minValue);
            details.put("max_value", maxValue);
            details.put("attempt", attempt);
            details.put("error", String.valueOf(error.getMessage()));
            auditLogger.log(AuditLogger.AuditEvent.of(ACTION_SCAN_PROBE_RETRY, resource, AuditLogger.RESULT_FAILED, details));
        }
    }
}
