package com.ttennebkram.imageparallel.processing.strategies;

import com.ttennebkram.imageparallel.model.PixelBuffer;
import com.ttennebkram.imageparallel.processing.WorkerFailure;
import com.ttennebkram.imageparallel.processing.kernels.TransformKernel;

import java.util.List;

/**
 * Orchestrates one stage: applies a kernel over a whole buffer.
 * Implementations must not return before every worker of the stage has finished,
 * so the next stage always sees the complete result.
 */
public interface ExecutionStrategy {

    /**
     * Label used in timing records (e.g., "Sequential", "CloneMergeParallel").
     */
    String getName();

    /**
     * Apply {@code kernel} to {@code buffer} in place.
     *
     * @return failures caught at worker boundaries, empty when every worker succeeded
     * @throws com.ttennebkram.imageparallel.processing.PipelineException if the stage cannot complete
     */
    List<WorkerFailure> runStage(TransformKernel kernel, PixelBuffer buffer);
}
