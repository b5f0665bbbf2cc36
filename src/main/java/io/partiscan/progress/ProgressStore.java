package io.partiscan.progress;

import io.partiscan.model.PartitionProgress;

import java.util.List;
import java.util.Optional;

/**
 * Durable home of partition progress rows. Implementations must make
 * {@link #conditionalUpdate} a single atomic compare-and-set per key; the tracker
 * holds no lock of its own.
 */
public interface ProgressStore {

    /**
     * Creates the row at offset 0 unless it already exists; returns the stored row either way.
     */
    PartitionProgress insertIfAbsent(ProgressKey key, long nowMs);

    Optional<PartitionProgress> find(ProgressKey key);

    /**
     * Applies {@code mutation} only if the stored row satisfies {@code condition}.
     *
     * @return true if the row was changed, false if it is missing or did not match
     */
    boolean conditionalUpdate(ProgressKey key, ProgressCondition condition, ProgressMutation mutation, long nowMs);

    /**
     * All rows of a run, ordered by partition id.
     */
    List<PartitionProgress> listByRun(String runId);
}
