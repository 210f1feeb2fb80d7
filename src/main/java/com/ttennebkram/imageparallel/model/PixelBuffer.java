package com.ttennebkram.imageparallel.model;

import java.util.Arrays;

/**
 * Dense 2-D grid of opaque RGB pixels, stored row-major as packed {@code 0xFFrrggbb} ints.
 * Every coordinate in [0, width) x [0, height) always holds a value.
 *
 * Not thread-safe. Strategies that share one buffer between threads guard access themselves.
 */
public class PixelBuffer {

    /** Alpha is fixed to fully opaque */
    public static final int OPAQUE = 0xFF000000;

    private final int width;
    private final int height;
    private final int[] pixels;

    /**
     * Create a black buffer.
     */
    public PixelBuffer(int width, int height) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Invalid buffer size " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.pixels = new int[area(width, height)];
        Arrays.fill(pixels, OPAQUE);
    }

    /**
     * Create a buffer from row-major packed RGB values. The array is copied.
     */
    public PixelBuffer(int width, int height, int[] rgb) {
        this(width, height);
        if (rgb.length != pixels.length) {
            throw new IllegalArgumentException("Expected " + pixels.length + " pixels, got " + rgb.length);
        }
        for (int i = 0; i < rgb.length; i++) {
            pixels[i] = rgb[i] | OPAQUE;
        }
    }

    private static int area(int width, int height) {
        try {
            return Math.multiplyExact(width, height);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Buffer size " + width + "x" + height + " is too large", e);
        }
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public boolean isEmpty() {
        return width == 0 || height == 0;
    }

    public int getRgb(int x, int y) {
        checkBounds(x, y);
        return pixels[y * width + x];
    }

    public void setRgb(int x, int y, int rgb) {
        checkBounds(x, y);
        pixels[y * width + x] = rgb | OPAQUE;
    }

    private void checkBounds(int x, int y) {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new IndexOutOfBoundsException("Pixel (" + x + ", " + y + ") outside " + width + "x" + height);
        }
    }

    /**
     * Full independent clone.
     */
    public PixelBuffer copy() {
        PixelBuffer clone = new PixelBuffer(width, height);
        System.arraycopy(pixels, 0, clone.pixels, 0, pixels.length);
        return clone;
    }

    /**
     * Copy one partition of this buffer into a new, independently owned buffer.
     * A COLUMNS partition yields a {@code partition.length() x height} buffer,
     * a ROWS partition a {@code width x partition.length()} buffer.
     */
    public PixelBuffer copyRegion(Axis axis, Partition partition) {
        checkPartition(axis, partition);
        if (axis == Axis.COLUMNS) {
            PixelBuffer sub = new PixelBuffer(partition.length(), height);
            for (int y = 0; y < height; y++) {
                System.arraycopy(pixels, y * width + partition.getStart(), sub.pixels, y * sub.width, sub.width);
            }
            return sub;
        }
        PixelBuffer sub = new PixelBuffer(width, partition.length());
        System.arraycopy(pixels, partition.getStart() * width, sub.pixels, 0, sub.pixels.length);
        return sub;
    }

    /**
     * Write a buffer produced by {@link #copyRegion} back into the same partition of this buffer.
     */
    public void paste(PixelBuffer sub, Axis axis, Partition partition) {
        checkPartition(axis, partition);
        int expectedWidth = axis == Axis.COLUMNS ? partition.length() : width;
        int expectedHeight = axis == Axis.COLUMNS ? height : partition.length();
        if (sub.width != expectedWidth || sub.height != expectedHeight) {
            throw new IllegalArgumentException("Sub-buffer " + sub.width + "x" + sub.height
                + " does not fit " + partition + " (expected " + expectedWidth + "x" + expectedHeight + ")");
        }
        if (axis == Axis.COLUMNS) {
            for (int y = 0; y < height; y++) {
                System.arraycopy(sub.pixels, y * sub.width, pixels, y * width + partition.getStart(), sub.width);
            }
        } else {
            System.arraycopy(sub.pixels, 0, pixels, partition.getStart() * width, sub.pixels.length);
        }
    }

    private void checkPartition(Axis axis, Partition partition) {
        int length = axis.lengthOf(this);
        if (partition.getEnd() > length) {
            throw new IndexOutOfBoundsException(partition + " exceeds " + axis + " length " + length);
        }
    }

    /**
     * Row-major copy of all pixels as packed ARGB, for display or encoding.
     */
    public int[] toArgbArray() {
        return Arrays.copyOf(pixels, pixels.length);
    }

    // Channel helpers

    public static int red(int rgb) {
        return (rgb >> 16) & 0xFF;
    }

    public static int green(int rgb) {
        return (rgb >> 8) & 0xFF;
    }

    public static int blue(int rgb) {
        return rgb & 0xFF;
    }

    public static int rgb(int r, int g, int b) {
        return OPAQUE | ((r & 0xFF) << 16) | ((g & 0xFF) << 8) | (b & 0xFF);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PixelBuffer)) return false;
        PixelBuffer other = (PixelBuffer) o;
        return width == other.width && height == other.height && Arrays.equals(pixels, other.pixels);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(pixels);
    }

    @Override
    public String toString() {
        return "PixelBuffer[" + width + "x" + height + "]";
    }
}
