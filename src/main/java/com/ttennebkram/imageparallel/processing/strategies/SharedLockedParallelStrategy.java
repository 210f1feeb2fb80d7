package com.ttennebkram.imageparallel.processing.strategies;

import com.ttennebkram.imageparallel.model.PartitionPlan;
import com.ttennebkram.imageparallel.model.PixelBuffer;
import com.ttennebkram.imageparallel.processing.PixelGuard;
import com.ttennebkram.imageparallel.processing.WorkerFailure;
import com.ttennebkram.imageparallel.processing.kernels.TransformKernel;

import java.util.List;

/**
 * Data-parallel strategy over one shared buffer.
 *
 * All workers mutate the same buffer in place, and every pixel read-modify-write
 * holds the monitor of that buffer. That keeps cross-partition writes (CyclicShift)
 * correct but serializes the workers, so this runs no faster than Sequential.
 * It is kept as a baseline for comparison, not as a fast path.
 */
public class SharedLockedParallelStrategy extends AbstractParallelStrategy {

    public SharedLockedParallelStrategy(int workerCount) {
        this(workerCount, false);
    }

    public SharedLockedParallelStrategy(int workerCount, boolean coverRemainder) {
        super(workerCount, coverRemainder);
    }

    @Override
    public String getName() {
        return StrategyType.SHARED_LOCKED_PARALLEL.getLabel();
    }

    @Override
    public List<WorkerFailure> runStage(TransformKernel kernel, PixelBuffer buffer) {
        PartitionPlan plan = planFor(kernel, buffer);
        // Taken once, before any worker starts, so no worker reads already-shifted pixels
        PixelBuffer snapshot = kernel.needsSnapshot() ? buffer.copy() : null;
        PixelGuard guard = PixelGuard.lockingOn(buffer);

        return forkJoin(kernel.getName(), plan,
            partition -> kernel.apply(buffer, snapshot, partition, guard));
    }
}
