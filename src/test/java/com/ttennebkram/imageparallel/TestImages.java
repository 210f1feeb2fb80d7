package com.ttennebkram.imageparallel;

import com.ttennebkram.imageparallel.model.PixelBuffer;

import java.util.Random;

/**
 * Buffers with known contents for tests.
 */
public final class TestImages {

    private TestImages() {
    }

    /**
     * Every pixel distinct: red = x, green = y, blue = 0x40. Width and height up to 256.
     */
    public static PixelBuffer indexed(int width, int height) {
        PixelBuffer buffer = new PixelBuffer(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                buffer.setRgb(x, y, PixelBuffer.rgb(x, y, 0x40));
            }
        }
        return buffer;
    }

    /**
     * Random pixels with every channel in [0, maxChannel].
     */
    public static PixelBuffer random(int width, int height, long seed, int maxChannel) {
        Random random = new Random(seed);
        PixelBuffer buffer = new PixelBuffer(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                buffer.setRgb(x, y, PixelBuffer.rgb(random.nextInt(maxChannel + 1),
                    random.nextInt(maxChannel + 1), random.nextInt(maxChannel + 1)));
            }
        }
        return buffer;
    }

    public static PixelBuffer random(int width, int height, long seed) {
        return random(width, height, seed, 255);
    }
}
