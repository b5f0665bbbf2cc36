package io.partiscan.model;

public record PartitionProgress(
        String runId,
        String partitionId,
        long nextOffset,
        boolean completed,
        long createdAtMs,
        long updatedAtMs
) {
    public static PartitionProgress fresh(String runId, String partitionId, long nowMs) {
        return new PartitionProgress(runId, partitionId, 0L, false, nowMs, nowMs);
    }

    public PartitionProgress withOffset(long offset, long nowMs) {
        return new PartitionProgress(runId, partitionId, offset, completed, createdAtMs, nowMs);
    }

    public PartitionProgress markCompleted(long offset, long nowMs) {
        return new PartitionProgress(runId, partitionId, offset, true, createdAtMs, nowMs);
    }
}
