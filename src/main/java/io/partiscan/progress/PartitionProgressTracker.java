package io.partiscan.progress;

import io.partiscan.model.PartitionProgress;
import io.partiscan.model.RunProgressSummary;
import io.partiscan.observability.AuditLogger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Idempotent per-partition progress for at-least-once page delivery.
 *
 * <p>Every transition is a compare-and-set against the stored offset, so a duplicate or
 * out-of-order page message can never move a partition backwards or past a completed state.
 * A rejected transition returns {@code false}; it is not an error.
 *
 * <p>No lock is held across a store call. Audit lines are appended after the store call
 * returns, through the shared {@link AuditLogger}, which orders writers to keep its hash chain.
 */
public final class PartitionProgressTracker {
    public static final String ACTION_INITIALIZE = "progress.initialize";
    public static final String ACTION_ADVANCE = "progress.advance";
    public static final String ACTION_COMPLETE = "progress.complete";

    private final ProgressStore store;
    private final AuditLogger auditLogger;
    private final LongSupplier clock;

    public PartitionProgressTracker(ProgressStore store) {
        this(store, null, System::currentTimeMillis);
    }

    public PartitionProgressTracker(ProgressStore store, AuditLogger auditLogger) {
        this(store, auditLogger, System::currentTimeMillis);
    }

    public PartitionProgressTracker(ProgressStore store, AuditLogger auditLogger, LongSupplier clock) {
        if (store == null) {
            throw new IllegalArgumentException("store must not be null");
        }
        this.store = store;
        this.auditLogger = auditLogger;
        this.clock = clock == null ? System::currentTimeMillis : clock;
    }

    public PartitionProgress initialize(String runId, String partitionId) {
        ProgressKey key = ProgressKey.of(runId, partitionId);
        PartitionProgress progress = store.insertIfAbsent(key, clock.getAsLong());
        audit(ACTION_INITIALIZE, AuditLogger.RESULT_OK, key, Map.of(
                "next_offset", progress.nextOffset(),
                "completed", progress.completed()
        ));
        return progress;
    }

    public PartitionProgress get(String runId, String partitionId) {
        ProgressKey key = ProgressKey.of(runId, partitionId);
        return store.find(key).orElseThrow(() -> new PartitionNotFoundException(runId, partitionId));
    }

    public boolean isCompleted(String runId, String partitionId) {
        return get(runId, partitionId).completed();
    }

    /**
     * Moves {@code nextOffset} from {@code currentOffset} to {@code newOffset}.
     *
     * @return false when the stored offset differs, the partition is completed, or it was never initialized
     */
    public boolean advance(String runId, String partitionId, long currentOffset, long newOffset) {
        ProgressKey key = ProgressKey.of(runId, partitionId);
        requireOffset("currentOffset", currentOffset);
        requireOffset("newOffset", newOffset);
        if (newOffset < currentOffset) {
            throw new IllegalArgumentException(
                    "newOffset must be >= currentOffset, got " + newOffset + " < " + currentOffset
            );
        }
        boolean applied = store.conditionalUpdate(
                key,
                ProgressCondition.activeAt(currentOffset),
                ProgressMutation.advanceTo(newOffset),
                clock.getAsLong()
        );
        auditTransition(ACTION_ADVANCE, key, applied, currentOffset, newOffset);
        return applied;
    }

    /**
     * Marks the partition completed at {@code finalOffset}, which must equal the stored offset.
     */
    public boolean complete(String runId, String partitionId, long finalOffset) {
        return complete(runId, partitionId, finalOffset, finalOffset);
    }

    /**
     * Marks the partition completed and moves its offset in the same update: the
     * stored offset must equal {@code expectedOffset}, and becomes {@code finalOffset}.
     */
    public boolean complete(String runId, String partitionId, long expectedOffset, long finalOffset) {
        ProgressKey key = ProgressKey.of(runId, partitionId);
        requireOffset("expectedOffset", expectedOffset);
        requireOffset("finalOffset", finalOffset);
        if (finalOffset < expectedOffset) {
            throw new IllegalArgumentException(
                    "finalOffset must be >= expectedOffset, got " + finalOffset + " < " + expectedOffset
            );
        }
        boolean applied = store.conditionalUpdate(
                key,
                ProgressCondition.activeAt(expectedOffset),
                ProgressMutation.completeAt(finalOffset),
                clock.getAsLong()
        );
        auditTransition(ACTION_COMPLETE, key, applied, expectedOffset, finalOffset);
        return applied;
    }

    public List<PartitionProgress> listRun(String runId) {
        requireRunId(runId);
        return store.listByRun(runId);
    }

    public RunProgressSummary summarize(String runId) {
        List<PartitionProgress> rows = listRun(runId);
        int completed = 0;
        for (PartitionProgress row : rows) {
            if (row.completed()) {
                completed++;
            }
        }
        return new RunProgressSummary(runId, rows.size(), completed, rows.size() - completed);
    }

    private void auditTransition(String action, ProgressKey key, boolean applied, long from, long to) {
        if (auditLogger == null) {
            return;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("expected_offset", from);
        details.put("target_offset", to);
        if (!applied) {
            Optional<PartitionProgress> actual = store.find(key);
            details.put("actual_offset", actual.map(PartitionProgress::nextOffset).orElse(null));
            details.put("actual_completed", actual.map(PartitionProgress::completed).orElse(null));
            details.put("reason", actual.isPresent() ? "state_mismatch" : "not_initialized");
        }
        audit(action, applied ? AuditLogger.RESULT_OK : AuditLogger.RESULT_REJECTED, key, details);
    }

    private void audit(String action, String result, ProgressKey key, Map<String, Object> details) {
        if (auditLogger == null) {
            return;
        }
        auditLogger.log(AuditLogger.AuditEvent.ofPartition(action, result, key.runId(), key.partitionId(), details));
    }

    private static void requireOffset(String name, long offset) {
        if (offset < 0L) {
            throw new IllegalArgumentException(name + " must be >= 0, got " + offset);
        }
    }

    private static void requireRunId(String runId) {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId must not be blank");
        }
    }
}
