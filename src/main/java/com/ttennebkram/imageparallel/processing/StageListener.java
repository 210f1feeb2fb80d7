package com.ttennebkram.imageparallel.processing;

import com.ttennebkram.imageparallel.model.PixelBuffer;
import com.ttennebkram.imageparallel.processing.kernels.TransformKernel;

/**
 * Callback around each stage of a pipeline run. Called on the coordinator thread,
 * so the buffer is never being written while a callback runs.
 */
public interface StageListener {

    default void beforeStage(int stageIndex, TransformKernel kernel, PixelBuffer buffer) {
    }

    default void afterStage(StageReport report, PixelBuffer buffer) {
    }
}
