package com.ttennebkram.imageparallel.processing.strategies;

import com.ttennebkram.imageparallel.TestImages;
import com.ttennebkram.imageparallel.model.Axis;
import com.ttennebkram.imageparallel.model.Partition;
import com.ttennebkram.imageparallel.model.PartitionPlan;
import com.ttennebkram.imageparallel.model.PixelBuffer;
import com.ttennebkram.imageparallel.processing.PipelineException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Merge-back of CloneMerge sub-buffers into the stage buffer.
 */
class CloneMergeMergeTest {

    private final CloneMergeParallelStrategy strategy = new CloneMergeParallelStrategy(2);

    private PixelBuffer original;
    private PixelBuffer buffer;
    private List<Partition> partitions;
    private PixelBuffer[] subBuffers;

    @BeforeEach
    void setUp() {
        original = TestImages.indexed(8, 3);
        buffer = original.copy();
        partitions = PartitionPlan.of(8, 2).getPartitions();
        subBuffers = new PixelBuffer[2];
        for (Partition partition : partitions) {
            PixelBuffer sub = buffer.copyRegion(Axis.COLUMNS, partition);
            sub.setRgb(0, 0, 0xFF000000 | partition.getIndex());
            subBuffers[partition.getIndex()] = sub;
        }
    }

    @Test
    void mergesEveryPartitionAndReleasesSlots() {
        strategy.merge("Test", buffer, Axis.COLUMNS, partitions, subBuffers, Collections.emptySet());

        assertEquals(0xFF000000, buffer.getRgb(0, 0));
        assertEquals(0xFF000001, buffer.getRgb(4, 0));
        assertEquals(original.getRgb(5, 2), buffer.getRgb(5, 2));
        assertNull(subBuffers[0]);
        assertNull(subBuffers[1]);
    }

    @Test
    void lostSubBufferAbortsBeforeAnyPaste() {
        subBuffers[1] = null;

        PipelineException e = assertThrows(PipelineException.class,
            () -> strategy.merge("Test", buffer, Axis.COLUMNS, partitions, subBuffers, Collections.emptySet()));

        assertTrue(e.getMessage().contains("lost"));
        assertEquals(original, buffer);
    }

    @Test
    void misSizedSubBufferAbortsBeforeAnyPaste() {
        subBuffers[1] = new PixelBuffer(3, 3);

        assertThrows(PipelineException.class,
            () -> strategy.merge("Test", buffer, Axis.COLUMNS, partitions, subBuffers, Collections.emptySet()));

        assertEquals(original, buffer);
    }

    @Test
    void failedPartitionNeedsNoSubBuffer() {
        subBuffers[0] = null;

        strategy.merge("Test", buffer, Axis.COLUMNS, partitions, subBuffers, Set.of(0));

        assertEquals(original.getRgb(0, 0), buffer.getRgb(0, 0));
        assertEquals(0xFF000001, buffer.getRgb(4, 0));
    }

    @Test
    void partitionOutsideBufferAbortsTheMerge() {
        List<Partition> tooWide = List.of(new Partition(0, 0, 4), new Partition(1, 8, 12));
        subBuffers[1] = new PixelBuffer(4, 3);

        PipelineException e = assertThrows(PipelineException.class,
            () -> strategy.merge("Test", buffer, Axis.COLUMNS, tooWide, subBuffers, Collections.emptySet()));

        assertTrue(e.getCause() instanceof IndexOutOfBoundsException);
    }
}
