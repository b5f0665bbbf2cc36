package io.partiscan.scan;

import io.partiscan.model.DensityChunk;
import io.partiscan.model.ScanStats;

import java.util.List;

public record DensityScan(List<DensityChunk> densityMap, ScanStats stats) {
    public DensityScan {
        densityMap = List.copyOf(densityMap);
    }

    public long totalRecords() {
        long total = 0L;
        for (DensityChunk chunk : densityMap) {
            total += chunk.count();
        }
        return total;
    }
}
