package io.partiscan.plan;

import io.partiscan.model.Partition;

import java.util.List;

/**
 * @param totalRecords     records covered by the partitions; below {@code scannedRecords} only when capped
 * @param scannedRecords   sum of the density map the plan was built from
 * @param targetPerPartition greedy cut threshold used while planning
 * @param desiredWorkers   partition count the planner aimed for
 */
public record PartitionPlan(
        List<Partition> partitions,
        long totalRecords,
        long scannedRecords,
        boolean capped,
        long targetPerPartition,
        int desiredWorkers
) {
    public PartitionPlan {
        partitions = List.copyOf(partitions);
    }

    public int workerCount() {
        return partitions.size();
    }
}
