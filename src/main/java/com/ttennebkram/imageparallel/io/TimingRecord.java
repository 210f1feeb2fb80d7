package com.ttennebkram.imageparallel.io;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * One line of the timing log: when a run happened, on what, how it ran, how long it took,
 * and where the output went.
 */
public final class TimingRecord {

    public static final String CSV_HEADER = "Timestamp;Image Size;Transformation;Duration (ms);Saved File Path";

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final LocalDateTime timestamp;
    private final int width;
    private final int height;
    private final String transformation;
    private final long durationMillis;
    private final Path outputPath;

    public TimingRecord(LocalDateTime timestamp, int width, int height, String transformation,
                        long durationMillis, Path outputPath) {
        this.timestamp = timestamp;
        this.width = width;
        this.height = height;
        this.transformation = transformation;
        this.durationMillis = durationMillis;
        this.outputPath = outputPath;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public String getTransformation() {
        return transformation;
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    public Path getOutputPath() {
        return outputPath;
    }

    public String toCsvLine() {
        return TIMESTAMP_FORMAT.format(timestamp) + ";" + width + "x" + height + ";" + transformation
            + ";" + durationMillis + ";" + outputPath;
    }

    @Override
    public String toString() {
        return toCsvLine();
    }
}
