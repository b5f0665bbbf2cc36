package io.partiscan.progress;

import io.partiscan.model.PartitionProgress;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local store keyed by {@link ProgressKey}. Atomicity comes from
 * {@link ConcurrentHashMap#compute}, which serializes writers per key only.
 */
public final class InMemoryProgressStore implements ProgressStore {
    private final ConcurrentMap<ProgressKey, PartitionProgress> rows = new ConcurrentHashMap<>();

    @Override
    public PartitionProgress insertIfAbsent(ProgressKey key, long nowMs) {
        return rows.computeIfAbsent(key, k -> PartitionProgress.fresh(key.runId(), key.partitionId(), nowMs));
    }

    @Override
    public Optional<PartitionProgress> find(ProgressKey key) {
        return Optional.ofNullable(rows.get(key));
    }

    @Override
    public boolean conditionalUpdate(ProgressKey key, ProgressCondition condition, ProgressMutation mutation, long nowMs) {
        boolean[] applied = new boolean[1];
        rows.computeIfPresent(key, (k, current) -> {
            if (!condition.test(current)) {
                return current;
            }
            applied[0] = true;
            return mutation.applyTo(current, nowMs);
        });
        return applied[0];
    }

    @Override
    public List<PartitionProgress> listByRun(String runId) {
        return rows.values().stream()
                .filter(p -> p.runId().equals(runId))
                .sorted(Comparator.comparing(PartitionProgress::partitionId))
                .toList();
    }

    public int size() {
        return rows.size();
    }
}
