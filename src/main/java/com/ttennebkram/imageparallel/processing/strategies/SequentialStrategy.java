package com.ttennebkram.imageparallel.processing.strategies;

import com.ttennebkram.imageparallel.model.Partition;
import com.ttennebkram.imageparallel.model.PixelBuffer;
import com.ttennebkram.imageparallel.processing.PixelGuard;
import com.ttennebkram.imageparallel.processing.WorkerFailure;
import com.ttennebkram.imageparallel.processing.kernels.TransformKernel;

import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single-threaded reference strategy.
 * Applies each kernel over the full axis on the calling thread; no partitioning, no remainder.
 */
public class SequentialStrategy implements ExecutionStrategy {

    private static final Logger LOG = Logger.getLogger(SequentialStrategy.class.getName());

    @Override
    public String getName() {
        return StrategyType.SEQUENTIAL.getLabel();
    }

    @Override
    public List<WorkerFailure> runStage(TransformKernel kernel, PixelBuffer buffer) {
        PixelBuffer snapshot = kernel.needsSnapshot() ? buffer.copy() : null;
        Partition all = Partition.whole(kernel.getAxis().lengthOf(buffer));
        try {
            kernel.apply(buffer, snapshot, all, PixelGuard.UNGUARDED);
            return Collections.emptyList();
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "[Sequential] " + kernel.getName() + " failed", e);
            return Collections.singletonList(new WorkerFailure(kernel.getName(), all.getIndex(), e));
        }
    }
}
