package io.partiscan.model;

/**
 * One page of work for a partition. The first item of every partition starts
 * at offset 0; each processed full page yields a continuation at the next offset.
 */
public record WorkItem(
        String runId,
        String partitionId,
        long minValue,
        long maxValue,
        long totalRecords,
        long offset,
        int limit
) {
    public WorkItem {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0, got " + offset);
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got " + limit);
        }
    }

    public static WorkItem first(String runId, Partition partition, int limit) {
        return new WorkItem(
                runId,
                partition.partitionId(),
                partition.minValue(),
                partition.maxValue(),
                partition.totalRecords(),
                0L,
                limit
        );
    }

    public WorkItem continueAt(long nextOffset) {
        return new WorkItem(runId, partitionId, minValue, maxValue, totalRecords, nextOffset, limit);
    }
}
