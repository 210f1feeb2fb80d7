package com.ttennebkram.imageparallel.processing;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of one stage: which kernel ran, how long it took and which workers failed.
 */
public final class StageReport {

    private final int stageIndex;
    private final String stageName;
    private final long elapsedNanos;
    private final List<WorkerFailure> failures;

    public StageReport(int stageIndex, String stageName, long elapsedNanos, List<WorkerFailure> failures) {
        this.stageIndex = stageIndex;
        this.stageName = stageName;
        this.elapsedNanos = elapsedNanos;
        this.failures = Collections.unmodifiableList(failures);
    }

    public int getStageIndex() {
        return stageIndex;
    }

    public String getStageName() {
        return stageName;
    }

    public long getElapsedNanos() {
        return elapsedNanos;
    }

    public double getElapsedMillis() {
        return elapsedNanos / 1_000_000.0;
    }

    public List<WorkerFailure> getFailures() {
        return failures;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("%s: %.3f ms%s", stageName, getElapsedMillis(),
            failures.isEmpty() ? "" : " (" + failures.size() + " failed)");
    }
}
