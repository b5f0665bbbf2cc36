package io.partiscan.progress;

public record ProgressKey(String runId, String partitionId) {
    public ProgressKey {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId must not be blank");
        }
        if (partitionId == null || partitionId.isBlank()) {
            throw new IllegalArgumentException("partitionId must not be blank");
        }
    }

    public static ProgressKey of(String runId, String partitionId) {
        return new ProgressKey(runId, partitionId);
    }

    @Override
    public String toString() {
        return runId + ":" + partitionId;
    }
}
