package io.partiscan.model;

public record RunProgressSummary(String runId, int partitions, int completed, int remaining) {
    public boolean allCompleted() {
        return partitions > 0 && remaining == 0;
    }
}
