package com.ttennebkram.imageparallel.processing.strategies;

import com.ttennebkram.imageparallel.model.Partition;
import com.ttennebkram.imageparallel.model.PartitionPlan;
import com.ttennebkram.imageparallel.model.PixelBuffer;
import com.ttennebkram.imageparallel.processing.PipelineException;
import com.ttennebkram.imageparallel.processing.WorkerFailure;
import com.ttennebkram.imageparallel.processing.kernels.TransformKernel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base class for fork/join strategies.
 * Every stage starts one thread per partition and joins all of them before returning.
 * No threads outlive a stage.
 */
public abstract class AbstractParallelStrategy implements ExecutionStrategy {

    private static final Logger LOG = Logger.getLogger(AbstractParallelStrategy.class.getName());

    /**
     * Work done by one worker thread for its partition.
     */
    @FunctionalInterface
    protected interface PartitionTask {
        void run(Partition partition);
    }

    private final int workerCount;
    private final boolean coverRemainder;

    protected AbstractParallelStrategy(int workerCount, boolean coverRemainder) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("Worker count must be at least 1: " + workerCount);
        }
        this.workerCount = workerCount;
        this.coverRemainder = coverRemainder;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public boolean isCoverRemainder() {
        return coverRemainder;
    }

    /**
     * Partition plan for the kernel's axis of this buffer.
     */
    protected PartitionPlan planFor(TransformKernel kernel, PixelBuffer buffer) {
        PartitionPlan plan = PartitionPlan.of(buffer, kernel.getAxis(), workerCount, coverRemainder);
        Partition skipped = plan.uncovered();
        if (!skipped.isEmpty()) {
            LOG.fine(() -> "[" + getName() + "] " + kernel.getName() + " leaves " + kernel.getAxis()
                + " [" + skipped.getStart() + ", " + skipped.getEnd() + ") unassigned");
        }
        return plan;
    }

    /**
     * Run {@code task} once per partition, each on its own thread, and wait for all of them.
     * Anything a worker throws, errors included, is caught at the thread boundary and
     * reported, so one failing partition does not stop its siblings.
     *
     * @return failures in partition order
     */
    protected List<WorkerFailure> forkJoin(String stageName, PartitionPlan plan, PartitionTask task) {
        List<Partition> partitions = plan.getPartitions();
        WorkerFailure[] failures = new WorkerFailure[partitions.size()];
        List<Thread> workers = new ArrayList<>(partitions.size());

        for (Partition partition : partitions) {
            Thread worker = new Thread(() -> {
                try {
                    task.run(partition);
                } catch (Throwable e) {
                    LOG.log(Level.WARNING, "[" + getName() + "] " + stageName + " worker "
                        + partition.getIndex() + " failed on " + partition, e);
                    failures[partition.getIndex()] = new WorkerFailure(stageName, partition.getIndex(), e);
                }
            }, getName() + "-" + stageName + "-" + partition.getIndex());
            worker.setDaemon(true);
            workers.add(worker);
        }

        for (Thread worker : workers) {
            worker.start();
        }

        for (Thread worker : workers) {
            try {
                worker.join();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new PipelineException("Interrupted while waiting for " + worker.getName(), e);
            }
        }

        // join() makes the workers' writes to the array visible here
        List<WorkerFailure> result = new ArrayList<>();
        for (WorkerFailure failure : failures) {
            if (failure != null) {
                result.add(failure);
            }
        }
        return result.isEmpty() ? Collections.emptyList() : result;
    }

    @Override
    public String toString() {
        return getName() + "[workers=" + workerCount + (coverRemainder ? ", coverRemainder" : "") + "]";
    }
}
