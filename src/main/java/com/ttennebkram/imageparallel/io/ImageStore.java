package com.ttennebkram.imageparallel.io;

import com.ttennebkram.imageparallel.model.PixelBuffer;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Decodes image files into pixel buffers and encodes them back.
 * The transformation engine never touches file bytes itself.
 */
public interface ImageStore {

    /**
     * Decode an image file.
     *
     * @throws IOException if the file is missing or cannot be decoded
     */
    PixelBuffer load(Path path) throws IOException;

    /**
     * Encode a buffer to {@code path}. The file extension selects the format.
     *
     * @throws IOException if the image cannot be written
     */
    void save(PixelBuffer buffer, Path path) throws IOException;
}
