package com.ttennebkram.imageparallel.io;

import com.ttennebkram.imageparallel.model.PixelBuffer;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Image store backed by OpenCV's imgcodecs (png, jpg, bmp, tiff, ...).
 * OpenCV keeps color images as 8-bit BGR; pixels are converted to packed RGB on the way in
 * and back to BGR on the way out.
 */
public class OpenCvImageStore implements ImageStore {

    private static final Logger LOG = Logger.getLogger(OpenCvImageStore.class.getName());

    private static boolean nativeLoaded = false;

    public OpenCvImageStore() {
        loadNativeLibrary();
    }

    /**
     * Load the OpenCV native library bundled with the openpnp artifact. Safe to call multiple times.
     */
    public static synchronized void loadNativeLibrary() {
        if (!nativeLoaded) {
            nu.pattern.OpenCV.loadLocally();
            nativeLoaded = true;
        }
    }

    /**
     * Whether the native library can be loaded on this platform.
     */
    public static boolean isAvailable() {
        try {
            loadNativeLibrary();
            return true;
        } catch (LinkageError | RuntimeException e) {
            LOG.log(Level.WARNING, "[OpenCvImageStore] OpenCV native library unavailable: " + e.getMessage());
            return false;
        }
    }

    @Override
    public PixelBuffer load(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("Image file not found: " + path);
        }
        Mat mat = Imgcodecs.imread(path.toString(), Imgcodecs.IMREAD_COLOR);
        try {
            if (mat.empty()) {
                throw new IOException("Could not decode image: " + path);
            }
            PixelBuffer buffer = matToBuffer(mat);
            LOG.fine(() -> "[OpenCvImageStore] Loaded " + path + " (" + buffer.getWidth() + "x" + buffer.getHeight() + ")");
            return buffer;
        } finally {
            mat.release();
        }
    }

    @Override
    public void save(PixelBuffer buffer, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Mat mat = bufferToMat(buffer);
        try {
            if (!Imgcodecs.imwrite(path.toString(), mat)) {
                throw new IOException("Could not encode image: " + path);
            }
        } finally {
            mat.release();
        }
    }

    static int channelBytes(int width, int height) {
        try {
            return Math.multiplyExact(Math.multiplyExact(width, height), 3);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Image " + width + "x" + height + " is too large", e);
        }
    }

    /**
     * Convert an 8-bit 3-channel BGR Mat to a pixel buffer.
     */
    static PixelBuffer matToBuffer(Mat mat) {
        if (mat.type() != CvType.CV_8UC3) {
            throw new IllegalArgumentException("Expected CV_8UC3 image, got " + CvType.typeToString(mat.type()));
        }
        int width = mat.cols();
        int height = mat.rows();
        byte[] bgr = new byte[channelBytes(width, height)];
        mat.get(0, 0, bgr);

        int[] rgb = new int[bgr.length / 3];
        for (int i = 0, p = 0; i < rgb.length; i++, p += 3) {
            rgb[i] = PixelBuffer.rgb(bgr[p + 2], bgr[p + 1], bgr[p]);
        }
        return new PixelBuffer(width, height, rgb);
    }

    /**
     * Convert a pixel buffer to a new 8-bit BGR Mat. The caller must release it.
     */
    static Mat bufferToMat(PixelBuffer buffer) {
        int[] rgb = buffer.toArgbArray();
        byte[] bgr = new byte[channelBytes(buffer.getWidth(), buffer.getHeight())];
        for (int i = 0, p = 0; i < rgb.length; i++, p += 3) {
            bgr[p] = (byte) PixelBuffer.blue(rgb[i]);
            bgr[p + 1] = (byte) PixelBuffer.green(rgb[i]);
            bgr[p + 2] = (byte) PixelBuffer.red(rgb[i]);
        }
        Mat mat = new Mat(buffer.getHeight(), buffer.getWidth(), CvType.CV_8UC3);
        mat.put(0, 0, bgr);
        return mat;
    }
}
