package com.ttennebkram.imageparallel.processing.kernels;

import com.ttennebkram.imageparallel.model.Axis;
import com.ttennebkram.imageparallel.model.PixelBuffer;
import com.ttennebkram.imageparallel.processing.PixelGuard;

/**
 * Cyclic shift kernel.
 * Moves every pixel {@code offset} positions along the shift axis, wrapping around at the edge:
 * the pixel at source s lands at {@code (s + offset) mod length}.
 *
 * Unlike Negate and HorizontalMirror the destination of a pixel may lie in another
 * partition, so reads come from a snapshot taken before the stage and the kernel
 * is partitioned by source range. The wrap length is the target's own axis length:
 * applied to a sub-buffer it wraps within that sub-buffer.
 */
public class CyclicShiftKernel extends TransformKernelBase {

    private final int offset;
    private final Axis axis;

    /**
     * Horizontal shift (along x), partitioned by columns.
     */
    public CyclicShiftKernel(int offset) {
        this(offset, Axis.COLUMNS);
    }

    /**
     * @param offset shift distance, may be negative or larger than the axis
     * @param axis   COLUMNS shifts along x, ROWS shifts along y
     */
    public CyclicShiftKernel(int offset, Axis axis) {
        this.offset = offset;
        this.axis = axis;
    }

    @Override
    public String getName() {
        return "CyclicShift";
    }

    @Override
    public Axis getAxis() {
        return axis;
    }

    public int getOffset() {
        return offset;
    }

    @Override
    public boolean needsSnapshot() {
        return true;
    }

    /**
     * Reduce an offset into [0, length).
     */
    public static int normalizeOffset(int offset, int length) {
        int shift = offset % length;
        if (shift < 0) {
            shift += length;
        }
        return shift;
    }

    @Override
    protected PixelGuard.PixelOperation createOperation(PixelBuffer target, PixelBuffer snapshot) {
        int length = axis.lengthOf(target);
        int shift = normalizeOffset(offset, length);
        if (axis == Axis.COLUMNS) {
            return (x, y) -> target.setRgb((x + shift) % length, y, snapshot.getRgb(x, y));
        }
        return (x, y) -> target.setRgb(x, (y + shift) % length, snapshot.getRgb(x, y));
    }

    @Override
    public int sample(PixelBuffer snapshot, int x, int y) {
        int length = axis.lengthOf(snapshot);
        int shift = normalizeOffset(offset, length);
        if (axis == Axis.COLUMNS) {
            return snapshot.getRgb((x - shift + length) % length, y);
        }
        return snapshot.getRgb(x, (y - shift + length) % length);
    }

    @Override
    public String toString() {
        return getName() + "(" + offset + (axis == Axis.ROWS ? ", vertical" : "") + ")";
    }
}
