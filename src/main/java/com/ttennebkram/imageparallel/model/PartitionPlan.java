package com.ttennebkram.imageparallel.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Divides one axis of length L into a fixed number of contiguous worker ranges.
 *
 * The partition width is {@code step = L / workers} (integer division), so partition i
 * covers {@code [i * step, (i + 1) * step)}. When L is not a multiple of the worker count
 * the trailing {@code L - workers * step} indices belong to no partition and are skipped
 * by every parallel strategy. Setting {@code coverRemainder} widens the last partition to
 * {@code [(workers - 1) * step, L)} instead.
 */
public final class PartitionPlan {

    private final int axisLength;
    private final int workerCount;
    private final boolean coverRemainder;
    private final int step;
    private final List<Partition> partitions;

    private PartitionPlan(int axisLength, int workerCount, boolean coverRemainder) {
        this.axisLength = axisLength;
        this.workerCount = workerCount;
        this.coverRemainder = coverRemainder;
        this.step = axisLength / workerCount;

        List<Partition> list = new ArrayList<>(workerCount);
        for (int i = 0; i < workerCount; i++) {
            int start = i * step;
            int end = (i + 1) * step;
            if (coverRemainder && i == workerCount - 1) {
                end = axisLength;
            }
            list.add(new Partition(i, start, end));
        }
        this.partitions = Collections.unmodifiableList(list);
    }

    /**
     * Plan that leaves the remainder unassigned.
     */
    public static PartitionPlan of(int axisLength, int workerCount) {
        return of(axisLength, workerCount, false);
    }

    public static PartitionPlan of(int axisLength, int workerCount, boolean coverRemainder) {
        if (axisLength < 0) {
            throw new IllegalArgumentException("Axis length must not be negative: " + axisLength);
        }
        if (workerCount < 1) {
            throw new IllegalArgumentException("Worker count must be at least 1: " + workerCount);
        }
        return new PartitionPlan(axisLength, workerCount, coverRemainder);
    }

    /**
     * Plan for the given axis of a buffer.
     */
    public static PartitionPlan of(PixelBuffer buffer, Axis axis, int workerCount, boolean coverRemainder) {
        return of(axis.lengthOf(buffer), workerCount, coverRemainder);
    }

    public int getAxisLength() {
        return axisLength;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public int getStep() {
        return step;
    }

    public boolean isCoverRemainder() {
        return coverRemainder;
    }

    public List<Partition> getPartitions() {
        return partitions;
    }

    /**
     * The trailing range no partition is assigned to. Empty when the plan covers the whole axis.
     */
    public Partition uncovered() {
        int coveredEnd = coverRemainder ? axisLength : workerCount * step;
        return new Partition(workerCount, coveredEnd, axisLength);
    }

    @Override
    public String toString() {
        return "PartitionPlan[length=" + axisLength + ", workers=" + workerCount
            + ", step=" + step + (coverRemainder ? ", coverRemainder" : "") + "]";
    }
}
