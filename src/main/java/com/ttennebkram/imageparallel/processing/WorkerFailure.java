package com.ttennebkram.imageparallel.processing;

/**
 * A failure caught at a worker boundary; sibling workers ran to completion.
 * Kernels validate before writing, so a rejected range is left unmodified. Private
 * copies of a failed worker are never merged back.
 */
public final class WorkerFailure {

    private final String stageName;
    private final int partitionIndex;
    private final Throwable cause;

    public WorkerFailure(String stageName, int partitionIndex, Throwable cause) {
        this.stageName = stageName;
        this.partitionIndex = partitionIndex;
        this.cause = cause;
    }

    public String getStageName() {
        return stageName;
    }

    public int getPartitionIndex() {
        return partitionIndex;
    }

    public Throwable getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return stageName + " partition " + partitionIndex + ": " + cause;
    }
}
