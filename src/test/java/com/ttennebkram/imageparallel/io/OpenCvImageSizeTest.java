package com.ttennebkram.imageparallel.io;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * BGR byte counts, which need no native library.
 */
class OpenCvImageSizeTest {

    @Test
    void byteCountIsThreePerPixel() {
        assertEquals(8 * 4 * 3, OpenCvImageStore.channelBytes(8, 4));
        assertEquals(0, OpenCvImageStore.channelBytes(0, 4));
    }

    @Test
    void oversizedImageIsRejected() {
        // 30000 x 30000 fits an int, three channels of it do not
        assertThrows(IllegalArgumentException.class, () -> OpenCvImageStore.channelBytes(30_000, 30_000));
        assertThrows(IllegalArgumentException.class, () -> OpenCvImageStore.channelBytes(100_000, 100_000));
    }
}
