package io.partiscan.plan;

import io.partiscan.model.DensityChunk;
import io.partiscan.model.Partition;
import io.partiscan.model.ScanConfig;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class PartitionPlannerTest {
    private final PartitionPlanner planner = new PartitionPlanner();

    @Test
    void cutsOnChunkBoundaries() {
        List<DensityChunk> map = List.of(
                new DensityChunk(0L, 1_000L, 2_000L),
                new DensityChunk(1_000L, 5_000L, 3_000L),
                new DensityChunk(5_000L, 10_000L, 1_000L)
        );

        PartitionPlan plan = planner.plan(map, 2);

        assertEquals(List.of(
                new Partition("partition-0", 0L, 5_000L, 5_000L),
                new Partition("partition-1", 5_000L, 10_000L, 1_000L)
        ), plan.partitions());
        assertEquals(6_000L, plan.totalRecords());
        assertEquals(3_000L, plan.targetPerPartition());
    }

    @Test
    void partitionsAreCompleteContiguousAndBounded() {
        List<DensityChunk> map = new ArrayList<>();
        long start = 0L;
        for (int i = 0; i < 40; i++) {
            long width = 10L + (i % 7) * 5L;
            long count = (i * 37L) % 90L;
            map.add(new DensityChunk(start, start + width, count));
            start += width;
        }
        long total = map.stream().mapToLong(DensityChunk::count).sum();

        for (int maxWorkers = 1; maxWorkers <= 12; maxWorkers++) {
            PartitionPlan plan = planner.plan(map, maxWorkers);
            List<Partition> partitions = plan.partitions();

            assertTrue(partitions.size() <= maxWorkers, "too many partitions for maxWorkers=" + maxWorkers);
            assertEquals(total, partitions.stream().mapToLong(Partition::totalRecords).sum());
            assertEquals(0L, partitions.get(0).minValue());
            assertEquals(start, partitions.get(partitions.size() - 1).maxValue());
            for (int i = 1; i < partitions.size(); i++) {
                assertEquals(partitions.get(i - 1).maxValue(), partitions.get(i).minValue());
                assertEquals("partition-" + i, partitions.get(i).partitionId());
            }
        }
    }

    @Test
    void zeroRecordsYieldSingleEmptyPartition() {
        List<DensityChunk> map = List.of(
                new DensityChunk(100L, 200L, 0L),
                new DensityChunk(200L, 900L, 0L)
        );

        PartitionPlan plan = planner.plan(map, 8);

        assertEquals(List.of(new Partition("partition-0", 100L, 900L, 0L)), plan.partitions());
        assertEquals(0L, plan.totalRecords());
        assertEquals(1, plan.workerCount());
    }

    @Test
    void emptyMapPlansTheConfiguredRange() {
        ScanConfig config = ScanConfig.builder().minValue(10L).maxValue(20_000L).build();

        PartitionPlan plan = planner.plan(List.of(), config);

        assertEquals(List.of(new Partition("partition-0", 10L, 20_000L, 0L)), plan.partitions());
    }

    @Test
    void chunkLargerThanTargetIsNeverSplit() {
        PartitionPlan plan = planner.plan(List.of(new DensityChunk(0L, 10L, 10_000L)), 5);

        assertEquals(1, plan.workerCount());
        assertEquals(10_000L, plan.partitions().get(0).totalRecords());
    }

    @Test
    void trailingEmptyChunksJoinThePreviousPartition() {
        List<DensityChunk> map = List.of(
                new DensityChunk(0L, 10L, 5L),
                new DensityChunk(10L, 20L, 5L),
                new DensityChunk(20L, 30L, 0L)
        );

        PartitionPlan plan = planner.plan(map, 3);

        assertEquals(List.of(
                new Partition("partition-0", 0L, 10L, 5L),
                new Partition("partition-1", 10L, 30L, 5L)
        ), plan.partitions());
    }

    @Test
    void minRecordsPerWorkerLimitsPartitionCount() {
        List<DensityChunk> map = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            map.add(new DensityChunk(i * 10L, i * 10L + 10L, 100L));
        }

        PartitionPlan plan = planner.plan(map, 10, 1_000L, 0L);

        assertEquals(3, plan.desiredWorkers());
        assertEquals(3, plan.workerCount());
        assertEquals(2_500L, plan.totalRecords());
    }

    @Test
    void capStopsPlanningInsideTheChunkThatReachesIt() {
        List<DensityChunk> map = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            map.add(new DensityChunk(i * 100L, i * 100L + 100L, 100L));
        }

        PartitionPlan plan = planner.plan(map, 1, 1L, 350L);

        assertEquals(List.of(new Partition("partition-0", 0L, 400L, 350L)), plan.partitions());
        assertEquals(350L, plan.totalRecords());
        assertEquals(1_000L, plan.scannedRecords());
        assertTrue(plan.capped());
    }

    @Test
    void capAboveTotalIsInactive() {
        List<DensityChunk> map = List.of(new DensityChunk(0L, 10L, 40L), new DensityChunk(10L, 20L, 60L));

        PartitionPlan plan = planner.plan(map, 2, 1L, 1_000L);

        assertFalse(plan.capped());
        assertEquals(100L, plan.totalRecords());
    }

    @Test
    void planFromScanConfigUsesItsWorkerSettings() {
        ScanConfig config = ScanConfig.builder().maxWorkers(4).minRecordsPerWorker(10L).build();
        List<DensityChunk> map = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            map.add(new DensityChunk(i * 10L, i * 10L + 10L, 10L));
        }

        PartitionPlan plan = planner.plan(map, config);

        assertEquals(4, plan.desiredWorkers());
        assertEquals(4, plan.workerCount());
        assertEquals(new Partition("partition-3", 60L, 80L, 20L), plan.partitions().get(3));
    }

    @Test
    void rejectsInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> planner.plan(List.of(), 2));
        assertThrows(IllegalArgumentException.class,
                () -> planner.plan(List.of(new DensityChunk(0L, 10L, 1L)), 0));
        assertThrows(IllegalArgumentException.class, () -> planner.plan(List.of(
                new DensityChunk(0L, 10L, 1L),
                new DensityChunk(20L, 30L, 1L)
        ), 2));
    }

    @Test
    void workerCountIsClamped() {
        assertEquals(0, PartitionPlanner.workerCount(0L, 10, 100L));
        assertEquals(1, PartitionPlanner.workerCount(5L, 10, 100L));
        assertEquals(3, PartitionPlanner.workerCount(201L, 10, 100L));
        assertEquals(10, PartitionPlanner.workerCount(1_000_000L, 10, 100L));
    }
}
