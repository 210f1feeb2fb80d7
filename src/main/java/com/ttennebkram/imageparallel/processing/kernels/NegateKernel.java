package com.ttennebkram.imageparallel.processing.kernels;

import com.ttennebkram.imageparallel.model.Axis;
import com.ttennebkram.imageparallel.model.PixelBuffer;
import com.ttennebkram.imageparallel.processing.PixelGuard;

/**
 * Negate kernel.
 * Replaces every channel c with 255 - c. Pixels are independent, so any partitioning is safe.
 */
public class NegateKernel extends TransformKernelBase {

    @Override
    public String getName() {
        return "Negate";
    }

    @Override
    public Axis getAxis() {
        return Axis.COLUMNS;
    }

    @Override
    protected PixelGuard.PixelOperation createOperation(PixelBuffer target, PixelBuffer snapshot) {
        return (x, y) -> target.setRgb(x, y, negate(target.getRgb(x, y)));
    }

    @Override
    public int sample(PixelBuffer snapshot, int x, int y) {
        return negate(snapshot.getRgb(x, y));
    }

    static int negate(int rgb) {
        return rgb ^ 0x00FFFFFF;
    }
}
