package com.ttennebkram.imageparallel.processing.kernels;

import com.ttennebkram.imageparallel.model.Axis;
import com.ttennebkram.imageparallel.model.Partition;
import com.ttennebkram.imageparallel.model.PixelBuffer;
import com.ttennebkram.imageparallel.processing.PixelGuard;

/**
 * A stateless pixel transformation applied to one partition of a buffer.
 * No dependencies on execution strategy or threading - strategies decide
 * which buffer, which range and which guard a kernel runs with.
 */
public interface TransformKernel {

    /**
     * Name used in stage reports and logs (e.g., "Negate", "CyclicShift").
     */
    String getName();

    /**
     * The axis this kernel must be partitioned along.
     */
    Axis getAxis();

    /**
     * Whether {@link #apply} reads from a snapshot of the buffer taken before the stage.
     * Kernels whose writes land outside the pixel they read need one.
     */
    default boolean needsSnapshot() {
        return false;
    }

    /**
     * Apply the transformation in place to the given range of {@code target}.
     * The range is validated before any pixel is written, so a rejected call
     * leaves the target untouched.
     *
     * @param target   buffer modified in place
     * @param snapshot read-only copy of target taken before the stage, or null when not needed
     * @param range    range along {@link #getAxis()}
     * @param guard    wraps every pixel read-modify-write
     */
    void apply(PixelBuffer target, PixelBuffer snapshot, Partition range, PixelGuard guard);

    /**
     * Pull form of the transformation: the value pixel (x, y) holds after this kernel
     * has been applied to the whole of {@code snapshot}.
     */
    int sample(PixelBuffer snapshot, int x, int y);
}
