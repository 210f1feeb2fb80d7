package com.ttennebkram.imageparallel.processing.strategies;

import com.ttennebkram.imageparallel.model.Axis;
import com.ttennebkram.imageparallel.model.Partition;
import com.ttennebkram.imageparallel.model.PartitionPlan;
import com.ttennebkram.imageparallel.model.PixelBuffer;
import com.ttennebkram.imageparallel.processing.PipelineException;
import com.ttennebkram.imageparallel.processing.PixelGuard;
import com.ttennebkram.imageparallel.processing.WorkerFailure;
import com.ttennebkram.imageparallel.processing.kernels.TransformKernel;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Task-parallel strategy with private copies.
 *
 * Before each stage the coordinator copies every partition into its own sub-buffer.
 * Workers transform only their sub-buffer (no shared mutable state, no locks), then
 * the coordinator pastes the sub-buffers back one by one after the join.
 *
 * Because a worker never sees pixels outside its partition, CyclicShift wraps
 * inside each partition instead of across the whole image. With more than one
 * worker the shifted output therefore differs from Sequential. The difference is
 * deterministic for a given worker count and offset.
 */
public class CloneMergeParallelStrategy extends AbstractParallelStrategy {

    private static final Logger LOG = Logger.getLogger(CloneMergeParallelStrategy.class.getName());

    public CloneMergeParallelStrategy(int workerCount) {
        this(workerCount, false);
    }

    public CloneMergeParallelStrategy(int workerCount, boolean coverRemainder) {
        super(workerCount, coverRemainder);
    }

    @Override
    public String getName() {
        return StrategyType.CLONE_MERGE_PARALLEL.getLabel();
    }

    @Override
    public List<WorkerFailure> runStage(TransformKernel kernel, PixelBuffer buffer) {
        Axis axis = kernel.getAxis();
        PartitionPlan plan = planFor(kernel, buffer);
        List<Partition> partitions = plan.getPartitions();

        // Split: one independently owned copy per partition
        PixelBuffer[] subBuffers = new PixelBuffer[partitions.size()];
        for (Partition partition : partitions) {
            subBuffers[partition.getIndex()] = buffer.copyRegion(axis, partition);
        }

        List<WorkerFailure> failures = forkJoin(kernel.getName(), plan, partition -> {
            PixelBuffer sub = subBuffers[partition.getIndex()];
            PixelBuffer snapshot = kernel.needsSnapshot() ? sub.copy() : null;
            kernel.apply(sub, snapshot, Partition.whole(axis.lengthOf(sub)), PixelGuard.UNGUARDED);
        });

        Set<Integer> failed = new HashSet<>();
        for (WorkerFailure failure : failures) {
            failed.add(failure.getPartitionIndex());
        }

        merge(kernel.getName(), buffer, axis, partitions, subBuffers, failed);
        return failures;
    }

    /**
     * Paste the sub-buffers of successful partitions back, in partition order.
     * Failed partitions keep their pre-stage pixels.
     *
     * Every slot is checked before the first paste. A missing or mis-sized sub-buffer,
     * or a paste that fails anyway, aborts the stage with a {@link PipelineException}.
     */
    void merge(String stageName, PixelBuffer buffer, Axis axis, List<Partition> partitions,
               PixelBuffer[] subBuffers, Set<Integer> failed) {
        for (Partition partition : partitions) {
            if (failed.contains(partition.getIndex())) {
                continue;
            }
            PixelBuffer sub = partition.getIndex() < subBuffers.length ? subBuffers[partition.getIndex()] : null;
            if (sub == null) {
                throw new PipelineException(stageName + ": sub-buffer for " + partition + " was lost");
            }
            int expectedLength = partition.length();
            int expectedCross = axis.crossLengthOf(buffer);
            if (axis.lengthOf(sub) != expectedLength || axis.crossLengthOf(sub) != expectedCross) {
                throw new PipelineException(stageName + ": sub-buffer " + sub.getWidth() + "x" + sub.getHeight()
                    + " does not fit " + partition);
            }
        }

        for (Partition partition : partitions) {
            if (failed.contains(partition.getIndex())) {
                LOG.fine(() -> "[" + getName() + "] skipping merge of failed " + partition);
                continue;
            }
            try {
                buffer.paste(subBuffers[partition.getIndex()], axis, partition);
            } catch (IllegalArgumentException | IndexOutOfBoundsException e) {
                throw new PipelineException(stageName + ": merge of " + partition + " failed", e);
            }
            subBuffers[partition.getIndex()] = null;
        }
    }
}
