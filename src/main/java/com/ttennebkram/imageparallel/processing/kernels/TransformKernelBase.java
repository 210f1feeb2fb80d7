package com.ttennebkram.imageparallel.processing.kernels;

import com.ttennebkram.imageparallel.model.Axis;
import com.ttennebkram.imageparallel.model.Partition;
import com.ttennebkram.imageparallel.model.PixelBuffer;
import com.ttennebkram.imageparallel.processing.PixelGuard;

/**
 * Abstract base class for kernels.
 * Handles range validation and iteration; subclasses supply the per-pixel operation.
 */
public abstract class TransformKernelBase implements TransformKernel {

    @Override
    public final void apply(PixelBuffer target, PixelBuffer snapshot, Partition range, PixelGuard guard) {
        validate(target, snapshot, range);
        if (range.isEmpty()) {
            return;
        }

        PixelGuard.PixelOperation op = createOperation(target, snapshot);
        int crossLength = crossLength(target);

        if (getAxis() == Axis.COLUMNS) {
            for (int y = 0; y < crossLength; y++) {
                for (int x = range.getStart(); x < range.getEnd(); x++) {
                    guard.run(op, x, y);
                }
            }
        } else {
            for (int y = range.getStart(); y < range.getEnd(); y++) {
                for (int x = 0; x < crossLength; x++) {
                    guard.run(op, x, y);
                }
            }
        }
    }

    /**
     * Build the per-pixel operation for one call to apply().
     */
    protected abstract PixelGuard.PixelOperation createOperation(PixelBuffer target, PixelBuffer snapshot);

    /**
     * How far along the other axis each partition is walked. Defaults to the full length.
     */
    protected int crossLength(PixelBuffer target) {
        return getAxis().crossLengthOf(target);
    }

    /**
     * Reject ranges and snapshots that would make the kernel write out of bounds or read stale data.
     */
    protected void validate(PixelBuffer target, PixelBuffer snapshot, Partition range) {
        if (target == null) {
            throw new IllegalArgumentException(getName() + ": target buffer is null");
        }
        if (range == null) {
            throw new IllegalArgumentException(getName() + ": range is null");
        }
        int length = getAxis().lengthOf(target);
        if (range.getEnd() > length) {
            throw new IllegalArgumentException(getName() + ": " + range + " exceeds "
                + getAxis() + " length " + length);
        }
        if (needsSnapshot()) {
            if (snapshot == null) {
                throw new IllegalArgumentException(getName() + " requires a snapshot");
            }
            if (snapshot.getWidth() != target.getWidth() || snapshot.getHeight() != target.getHeight()) {
                throw new IllegalArgumentException(getName() + ": snapshot " + snapshot
                    + " does not match target " + target);
            }
        }
    }

    @Override
    public String toString() {
        return getName();
    }
}
