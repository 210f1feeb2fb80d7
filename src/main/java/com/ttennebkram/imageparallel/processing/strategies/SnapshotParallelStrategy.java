package com.ttennebkram.imageparallel.processing.strategies;

import com.ttennebkram.imageparallel.model.Axis;
import com.ttennebkram.imageparallel.model.Partition;
import com.ttennebkram.imageparallel.model.PartitionPlan;
import com.ttennebkram.imageparallel.model.PixelBuffer;
import com.ttennebkram.imageparallel.processing.WorkerFailure;
import com.ttennebkram.imageparallel.processing.kernels.TransformKernel;

import java.util.List;

/**
 * Lock-free double-buffered strategy.
 *
 * The coordinator snapshots the buffer once per stage. Partitions are destination
 * ranges: each worker computes, for every pixel it owns, the source value through
 * {@link TransformKernel#sample} on the immutable snapshot and writes it exactly once.
 * No two workers write the same pixel and nobody writes the snapshot, so no lock is
 * needed and CyclicShift keeps its whole-image wrap.
 */
public class SnapshotParallelStrategy extends AbstractParallelStrategy {

    public SnapshotParallelStrategy(int workerCount) {
        this(workerCount, false);
    }

    public SnapshotParallelStrategy(int workerCount, boolean coverRemainder) {
        super(workerCount, coverRemainder);
    }

    @Override
    public String getName() {
        return StrategyType.SNAPSHOT_PARALLEL.getLabel();
    }

    @Override
    public List<WorkerFailure> runStage(TransformKernel kernel, PixelBuffer buffer) {
        Axis axis = kernel.getAxis();
        PartitionPlan plan = planFor(kernel, buffer);
        PixelBuffer snapshot = buffer.copy();

        return forkJoin(kernel.getName(), plan, partition -> {
            int length = axis.lengthOf(buffer);
            if (partition.getEnd() > length) {
                throw new IllegalArgumentException(kernel.getName() + ": " + partition
                    + " exceeds " + axis + " length " + length);
            }
            int crossLength = axis.crossLengthOf(buffer);
            for (int i = partition.getStart(); i < partition.getEnd(); i++) {
                for (int j = 0; j < crossLength; j++) {
                    int x = axis == Axis.COLUMNS ? i : j;
                    int y = axis == Axis.COLUMNS ? j : i;
                    buffer.setRgb(x, y, kernel.sample(snapshot, x, y));
                }
            }
        });
    }
}
