package com.ttennebkram.imageparallel.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PartitionPlanTest {

    @Test
    void evenSplit() {
        PartitionPlan plan = PartitionPlan.of(8, 2);
        assertEquals(4, plan.getStep());
        assertEquals(List.of(new Partition(0, 0, 4), new Partition(1, 4, 8)), plan.getPartitions());
        assertTrue(plan.uncovered().isEmpty());
    }

    @Test
    void remainderIsLeftUnassigned() {
        PartitionPlan plan = PartitionPlan.of(10, 4);
        assertEquals(2, plan.getStep());
        assertEquals(4, plan.getPartitions().size());
        assertEquals(new Partition(3, 6, 8), plan.getPartitions().get(3));

        Partition uncovered = plan.uncovered();
        assertEquals(8, uncovered.getStart());
        assertEquals(10, uncovered.getEnd());
    }

    @Test
    void coverRemainderWidensLastPartition() {
        PartitionPlan plan = PartitionPlan.of(10, 4, true);
        assertEquals(new Partition(3, 6, 10), plan.getPartitions().get(3));
        assertTrue(plan.uncovered().isEmpty());
    }

    @Test
    void moreWorkersThanIndicesLeavesEverythingUnassigned() {
        PartitionPlan plan = PartitionPlan.of(3, 8);
        assertEquals(0, plan.getStep());
        assertEquals(8, plan.getPartitions().size());
        for (Partition partition : plan.getPartitions()) {
            assertTrue(partition.isEmpty());
        }
        assertEquals(3, plan.uncovered().length());
    }

    @Test
    void partitionsAreDisjointAndContiguous() {
        PartitionPlan plan = PartitionPlan.of(1000, 16);
        int expectedStart = 0;
        for (Partition partition : plan.getPartitions()) {
            assertEquals(expectedStart, partition.getStart());
            assertEquals(plan.getStep(), partition.length());
            expectedStart = partition.getEnd();
        }
        assertEquals(expectedStart, plan.uncovered().getStart());
    }

    @Test
    void planForBufferAxis() {
        PixelBuffer buffer = new PixelBuffer(12, 6);
        assertEquals(12, PartitionPlan.of(buffer, Axis.COLUMNS, 3, false).getAxisLength());
        assertEquals(6, PartitionPlan.of(buffer, Axis.ROWS, 3, false).getAxisLength());
    }

    @Test
    void invalidArgumentsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> PartitionPlan.of(10, 0));
        assertThrows(IllegalArgumentException.class, () -> PartitionPlan.of(-1, 2));
        assertThrows(IllegalArgumentException.class, () -> new Partition(0, 5, 3));
    }
}
