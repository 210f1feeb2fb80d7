package com.ttennebkram.imageparallel.processing;

import com.ttennebkram.imageparallel.model.PixelBuffer;

import java.util.Collections;
import java.util.List;

/**
 * Output of one pipeline run: the transformed buffer plus per-stage timings.
 */
public final class PipelineResult {

    private final PixelBuffer output;
    private final String strategyName;
    private final List<StageReport> stageReports;
    private final long totalNanos;

    public PipelineResult(PixelBuffer output, String strategyName, List<StageReport> stageReports, long totalNanos) {
        this.output = output;
        this.strategyName = strategyName;
        this.stageReports = Collections.unmodifiableList(stageReports);
        this.totalNanos = totalNanos;
    }

    public PixelBuffer getOutput() {
        return output;
    }

    public String getStrategyName() {
        return strategyName;
    }

    public List<StageReport> getStageReports() {
        return stageReports;
    }

    public long getTotalNanos() {
        return totalNanos;
    }

    public long getTotalMillis() {
        return totalNanos / 1_000_000L;
    }

    public boolean hasFailures() {
        for (StageReport report : stageReports) {
            if (report.hasFailures()) {
                return true;
            }
        }
        return false;
    }
}
