package com.ttennebkram.imageparallel.model;

/**
 * The axis a buffer is partitioned along.
 * COLUMNS splits the x range (each partition spans the full height),
 * ROWS splits the y range (each partition spans the full width).
 */
public enum Axis {
    COLUMNS,
    ROWS;

    /**
     * Length of this axis for the given buffer (width for COLUMNS, height for ROWS).
     */
    public int lengthOf(PixelBuffer buffer) {
        return this == COLUMNS ? buffer.getWidth() : buffer.getHeight();
    }

    /**
     * Length of the other axis for the given buffer.
     */
    public int crossLengthOf(PixelBuffer buffer) {
        return this == COLUMNS ? buffer.getHeight() : buffer.getWidth();
    }
}
