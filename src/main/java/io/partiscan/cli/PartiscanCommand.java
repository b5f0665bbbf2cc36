package io.partiscan.cli;

import io.partiscan.config.PartiscanConfig;
import io.partiscan.model.PartitionProgress;
import io.partiscan.model.ScanConfig;
import io.partiscan.model.ScanHistory;
import io.partiscan.model.ScanMode;
import io.partiscan.model.ScanResult;
import io.partiscan.model.WorkItem;
import io.partiscan.observability.AuditLogger;
import io.partiscan.progress.PartitionNotFoundException;
import io.partiscan.runtime.PartiscanRuntime;
import io.partiscan.scan.ScanException;
import io.partiscan.scan.SortedValuesCounter;
import io.partiscan.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "partiscan",
        mixinStandardHelpOptions = true,
        description = "Density scanner, partition planner and partition progress tracker",
        subcommands = {
                PartiscanCommand.InitCommand.class,
                PartiscanCommand.ScanCommand.class,
                PartiscanCommand.PreviewCommand.class,
                PartiscanCommand.HistoryCommand.class,
                PartiscanCommand.PlanCommand.class,
                PartiscanCommand.ProgressCommand.class,
                PartiscanCommand.AuditVerifyCommand.class,
                PartiscanCommand.SchemaMigrationsCommand.class
        }
)
public final class PartiscanCommand implements Runnable {

    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--feed"}, description = "Feed the scans are recorded under", defaultValue = "default")
    String feed;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | scan | preview | history | plan | progress | audit-verify | schema-migrations");
    }

    PartiscanRuntime runtime() {
        PartiscanConfig config = PartiscanConfig.fromRoot(root, feed);
        return new PartiscanRuntime(config);
    }

    static int printError(String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        System.out.println(Jsons.toJson(body));
        return 1;
    }

    static Map<String, Object> transition(PartitionProgress progress, boolean applied) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("applied", applied);
        body.put("progress", progress);
        return body;
    }

    @Command(name = "init", description = "Initialize the data root, SQLite schema and audit log")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        PartiscanCommand parent;

        @Override
        public Integer call() {
            PartiscanRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println("Initialized partiscan at: " + runtime.config().rootDir());
            return 0;
        }
    }

    @Command(name = "scan", description = "Scan a values file and plan partitions for a run")
    static final class ScanCommand implements Callable<Integer> {
        @ParentCommand
        PartiscanCommand parent;

        @Option(names = {"--values"}, required = true, description = "File with one integral value per line")
        Path values;

        @Option(names = {"--mode"}, description = "single-pass | two-pass")
        String mode;

        @Option(names = {"--min"}, description = "Lower bound (inclusive)")
        Long minValue;

        @Option(names = {"--max"}, description = "Upper bound (exclusive)")
        Long maxValue;

        @Option(names = {"--max-workers"}, description = "Upper bound on partitions")
        Integer maxWorkers;

        @Option(names = {"--max-total-records"}, description = "Stop planning after this many records; 0 = unlimited")
        Long maxTotalRecords;

        @Override
        public Integer call() {
            PartiscanRuntime runtime = parent.runtime();
            runtime.init();
            ScanConfig.Builder builder = runtime.settings().baseScanConfig().toBuilder();
            if (mode != null) {
                builder.mode(ScanMode.fromString(mode));
            }
            if (minValue != null) {
                builder.minValue(minValue);
            }
            if (maxValue != null) {
                builder.maxValue(maxValue);
            }
            if (maxWorkers != null) {
                builder.maxWorkers(maxWorkers);
            }
            if (maxTotalRecords != null) {
                builder.maxTotalRecords(maxTotalRecords);
            }
            try {
                ScanResult result = runtime.runScan(SortedValuesCounter.fromFile(values), builder.build());
                System.out.println(Jsons.toJson(result));
                return 0;
            } catch (IOException e) {
                return printError("values_unreadable", e.getMessage());
            } catch (ScanException e) {
                return printError("scan_failed", e.getMessage());
            } catch (IllegalArgumentException e) {
                return printError("invalid_config", e.getMessage());
            }
        }
    }

    @Command(name = "preview", description = "Cheap two-pass scan with coarse steps and at most 10 partitions")
    static final class PreviewCommand implements Callable<Integer> {
        @ParentCommand
        PartiscanCommand parent;

        @Option(names = {"--values"}, required = true, description = "File with one integral value per line")
        Path values;

        @Option(names = {"--min"}, description = "Lower bound (inclusive)")
        Long minValue;

        @Option(names = {"--max"}, description = "Upper bound (exclusive), default 100000")
        Long maxValue;

        @Override
        public Integer call() {
            PartiscanRuntime runtime = parent.runtime();
            runtime.init();
            try {
                ScanResult result = runtime.previewScan(SortedValuesCounter.fromFile(values), minValue, maxValue);
                System.out.println(Jsons.toJson(result));
                return 0;
            } catch (IOException e) {
                return printError("values_unreadable", e.getMessage());
            } catch (ScanException e) {
                return printError("scan_failed", e.getMessage());
            } catch (IllegalArgumentException e) {
                return printError("invalid_config", e.getMessage());
            }
        }
    }

    @Command(name = "history", description = "Show the latest run and preview scan of the feed")
    static final class HistoryCommand implements Callable<Integer> {
        @ParentCommand
        PartiscanCommand parent;

        @Override
        public Integer call() {
            PartiscanRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.getScanHistory()));
            return 0;
        }
    }

    @Command(name = "plan", description = "Create progress rows and first work items from the latest run scan")
    static final class PlanCommand implements Callable<Integer> {
        @ParentCommand
        PartiscanCommand parent;

        @Option(names = {"--run-id"}, required = true, description = "Run identifier")
        String runId;

        @Option(names = {"--page-limit"}, defaultValue = "0", description = "Records per page; 0 uses the configured limit")
        int pageLimit;

        @Override
        public Integer call() {
            PartiscanRuntime runtime = parent.runtime();
            runtime.init();
            ScanHistory history = runtime.getScanHistory();
            if (history.run() == null) {
                return printError("no_run_scan", "no run scan recorded for feed " + history.feed());
            }
            List<WorkItem> items = runtime.planWorkItems(runId, history.run().result(), pageLimit);
            System.out.println(Jsons.toJson(items));
            return 0;
        }
    }

    @Command(
            name = "progress",
            description = "Partition progress operations",
            subcommands = {
                    ProgressInitCommand.class,
                    ProgressGetCommand.class,
                    ProgressAdvanceCommand.class,
                    ProgressCompleteCommand.class,
                    ProgressListCommand.class
            }
    )
    static final class ProgressCommand implements Runnable {
        @ParentCommand
        PartiscanCommand parent;

        @Override
        public void run() {
            System.out.println("Use subcommands: init | get | advance | complete | list");
        }
    }

    @Command(name = "init", description = "Create a partition's progress row at offset 0 if it does not exist")
    static final class ProgressInitCommand implements Callable<Integer> {
        @ParentCommand
        ProgressCommand parent;

        @Parameters(index = "0", description = "Run id")
        String runId;

        @Parameters(index = "1", description = "Partition id")
        String partitionId;

        @Override
        public Integer call() {
            PartiscanRuntime runtime = parent.parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.tracker().initialize(runId, partitionId)));
            return 0;
        }
    }

    @Command(name = "get", description = "Show a partition's progress")
    static final class ProgressGetCommand implements Callable<Integer> {
        @ParentCommand
        ProgressCommand parent;

        @Parameters(index = "0", description = "Run id")
        String runId;

        @Parameters(index = "1", description = "Partition id")
        String partitionId;

        @Override
        public Integer call() {
            PartiscanRuntime runtime = parent.parent.runtime();
            runtime.init();
            try {
                System.out.println(Jsons.toJson(runtime.progress(runId, partitionId)));
                return 0;
            } catch (PartitionNotFoundException e) {
                return printError("partition_not_found", e.getMessage());
            }
        }
    }

    @Command(name = "advance", description = "Move nextOffset from CURRENT to NEW if it still equals CURRENT")
    static final class ProgressAdvanceCommand implements Callable<Integer> {
        @ParentCommand
        ProgressCommand parent;

        @Parameters(index = "0", description = "Run id")
        String runId;

        @Parameters(index = "1", description = "Partition id")
        String partitionId;

        @Parameters(index = "2", description = "Offset the caller processed from")
        long currentOffset;

        @Parameters(index = "3", description = "Offset to move to")
        long newOffset;

        @Override
        public Integer call() {
            PartiscanRuntime runtime = parent.parent.runtime();
            runtime.init();
            try {
                boolean applied = runtime.tracker().advance(runId, partitionId, currentOffset, newOffset);
                System.out.println(Jsons.toJson(transition(runtime.tracker().get(runId, partitionId), applied)));
                return applied ? 0 : 1;
            } catch (PartitionNotFoundException e) {
                return printError("partition_not_found", e.getMessage());
            } catch (IllegalArgumentException e) {
                return printError("invalid_argument", e.getMessage());
            }
        }
    }

    @Command(name = "complete", description = "Mark a partition completed if nextOffset still equals the expected offset")
    static final class ProgressCompleteCommand implements Callable<Integer> {
        @ParentCommand
        ProgressCommand parent;

        @Parameters(index = "0", description = "Run id")
        String runId;

        @Parameters(index = "1", description = "Partition id")
        String partitionId;

        @Parameters(index = "2", description = "Final offset")
        long finalOffset;

        @Option(names = {"--from"}, description = "Expected stored offset when it differs from the final offset")
        Long expectedOffset;

        @Override
        public Integer call() {
            PartiscanRuntime runtime = parent.parent.runtime();
            runtime.init();
            long expected = expectedOffset == null ? finalOffset : expectedOffset;
            try {
                boolean applied = runtime.tracker().complete(runId, partitionId, expected, finalOffset);
                System.out.println(Jsons.toJson(transition(runtime.tracker().get(runId, partitionId), applied)));
                return applied ? 0 : 1;
            } catch (PartitionNotFoundException e) {
                return printError("partition_not_found", e.getMessage());
            } catch (IllegalArgumentException e) {
                return printError("invalid_argument", e.getMessage());
            }
        }
    }

    @Command(name = "list", description = "List a run's partitions with a completion summary")
    static final class ProgressListCommand implements Callable<Integer> {
        @ParentCommand
        ProgressCommand parent;

        @Parameters(index = "0", description = "Run id")
        String runId;

        @Override
        public Integer call() {
            PartiscanRuntime runtime = parent.parent.runtime();
            runtime.init();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("summary", runtime.summarizeRun(runId));
            body.put("partitions", runtime.runProgress(runId));
            System.out.println(Jsons.toJson(body));
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        PartiscanCommand parent;

        @Override
        public Integer call() {
            PartiscanRuntime runtime = parent.runtime();
            runtime.init();
            AuditLogger.IntegrityReport report = runtime.verifyAudit();
            System.out.println(Jsons.toJson(report));
            return report.ok() ? 0 : 1;
        }
    }

    @Command(name = "schema-migrations", description = "List applied schema migrations")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        PartiscanCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows to print")
        int limit;

        @Override
        public Integer call() {
            PartiscanRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.schemaMigrations(limit)));
            return 0;
        }
    }
}
