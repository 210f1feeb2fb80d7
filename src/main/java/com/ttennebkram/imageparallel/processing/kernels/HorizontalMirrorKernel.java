package com.ttennebkram.imageparallel.processing.kernels;

import com.ttennebkram.imageparallel.model.Axis;
import com.ttennebkram.imageparallel.model.PixelBuffer;
import com.ttennebkram.imageparallel.processing.PixelGuard;

/**
 * Horizontal mirror kernel.
 * Flips the image top to bottom by swapping row y with row height - 1 - y.
 * Each swap stays inside one column, so the kernel is always partitioned by columns:
 * splitting rows would separate a matched pair of rows across two workers.
 */
public class HorizontalMirrorKernel extends TransformKernelBase {

    @Override
    public String getName() {
        return "HorizontalMirror";
    }

    @Override
    public Axis getAxis() {
        return Axis.COLUMNS;
    }

    /**
     * Only the top half is walked; each step swaps a pair. The middle row of an odd height stays put.
     */
    @Override
    protected int crossLength(PixelBuffer target) {
        return target.getHeight() / 2;
    }

    @Override
    protected PixelGuard.PixelOperation createOperation(PixelBuffer target, PixelBuffer snapshot) {
        int height = target.getHeight();
        return (x, y) -> {
            int mirrorY = height - 1 - y;
            int top = target.getRgb(x, y);
            int bottom = target.getRgb(x, mirrorY);
            target.setRgb(x, y, bottom);
            target.setRgb(x, mirrorY, top);
        };
    }

    @Override
    public int sample(PixelBuffer snapshot, int x, int y) {
        return snapshot.getRgb(x, snapshot.getHeight() - 1 - y);
    }
}
