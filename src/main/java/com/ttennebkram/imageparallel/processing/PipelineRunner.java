package com.ttennebkram.imageparallel.processing;

import com.ttennebkram.imageparallel.model.PixelBuffer;
import com.ttennebkram.imageparallel.processing.kernels.CyclicShiftKernel;
import com.ttennebkram.imageparallel.processing.kernels.HorizontalMirrorKernel;
import com.ttennebkram.imageparallel.processing.kernels.NegateKernel;
import com.ttennebkram.imageparallel.processing.kernels.TransformKernel;
import com.ttennebkram.imageparallel.processing.strategies.ExecutionStrategy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Runs a fixed list of kernels, in order, through one execution strategy.
 *
 * The input buffer is cloned first and never modified. Each stage completes
 * (all of its workers joined) before the next one starts.
 */
public class PipelineRunner {

    private static final Logger LOG = Logger.getLogger(PipelineRunner.class.getName());

    private final List<TransformKernel> stages;
    private StageListener stageListener;

    public PipelineRunner(List<TransformKernel> stages) {
        if (stages == null || stages.isEmpty()) {
            throw new IllegalArgumentException("Pipeline needs at least one stage");
        }
        this.stages = Collections.unmodifiableList(new ArrayList<>(stages));
    }

    /**
     * The standard pipeline: Negate, then HorizontalMirror, then a horizontal CyclicShift.
     */
    public static PipelineRunner standard(int shiftOffset) {
        return new PipelineRunner(Arrays.asList(
            new NegateKernel(),
            new HorizontalMirrorKernel(),
            new CyclicShiftKernel(shiftOffset)));
    }

    public List<TransformKernel> getStages() {
        return stages;
    }

    public void setStageListener(StageListener stageListener) {
        this.stageListener = stageListener;
    }

    /**
     * Transform a clone of {@code source} with the given strategy.
     *
     * @throws NullPointerException     if source or strategy is null
     * @throws IllegalArgumentException if source has zero area
     * @throws PipelineException        if a stage has to be aborted
     */
    public PipelineResult run(PixelBuffer source, ExecutionStrategy strategy) {
        Objects.requireNonNull(source, "source buffer");
        Objects.requireNonNull(strategy, "strategy");
        if (source.isEmpty()) {
            throw new IllegalArgumentException("Cannot transform a zero-area buffer: " + source);
        }

        PixelBuffer buffer = source.copy();
        List<StageReport> reports = new ArrayList<>(stages.size());

        long runStart = System.nanoTime();
        for (int i = 0; i < stages.size(); i++) {
            TransformKernel kernel = stages.get(i);
            if (stageListener != null) {
                stageListener.beforeStage(i, kernel, buffer);
            }

            long stageStart = System.nanoTime();
            List<WorkerFailure> failures = strategy.runStage(kernel, buffer);
            StageReport report = new StageReport(i, kernel.getName(), System.nanoTime() - stageStart, failures);
            reports.add(report);

            LOG.fine(() -> "[" + strategy.getName() + "] " + report);
            if (stageListener != null) {
                stageListener.afterStage(report, buffer);
            }
        }
        long totalNanos = System.nanoTime() - runStart;

        PipelineResult result = new PipelineResult(buffer, strategy.getName(), reports, totalNanos);
        LOG.info(() -> String.format("[%s] %dx%d transformed in %d ms%s", strategy.getName(),
            buffer.getWidth(), buffer.getHeight(), result.getTotalMillis(),
            result.hasFailures() ? " with worker failures" : ""));
        return result;
    }
}
