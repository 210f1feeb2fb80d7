package com.ttennebkram.imageparallel.config;

import com.ttennebkram.imageparallel.processing.strategies.StrategyType;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Settings for a transformation session.
 * Passed explicitly to the session and its collaborators instead of living in global state.
 */
public class RunConfiguration {

    public static final String DEFAULT_SAVE_DIRECTORY = "SavedImages";
    public static final String DEFAULT_LOG_FILE = "image_transformations_log.csv";
    public static final String DEFAULT_IMAGE_FORMAT = "bmp";
    public static final int DEFAULT_WORKER_COUNT = 16;
    public static final int DEFAULT_SHIFT_OFFSET = 50;

    private Path saveDirectory = Paths.get(DEFAULT_SAVE_DIRECTORY);
    private Path logFile = Paths.get(DEFAULT_LOG_FILE);
    private String imageFormat = DEFAULT_IMAGE_FORMAT;
    private int workerCount = DEFAULT_WORKER_COUNT;
    private int shiftOffset = DEFAULT_SHIFT_OFFSET;
    private StrategyType strategy = StrategyType.SEQUENTIAL;
    private boolean coverRemainder = false;

    public Path getSaveDirectory() {
        return saveDirectory;
    }

    public void setSaveDirectory(Path saveDirectory) {
        if (saveDirectory == null) {
            throw new IllegalArgumentException("Save directory must not be null");
        }
        this.saveDirectory = saveDirectory;
    }

    public Path getLogFile() {
        return logFile;
    }

    public void setLogFile(Path logFile) {
        if (logFile == null) {
            throw new IllegalArgumentException("Log file must not be null");
        }
        this.logFile = logFile;
    }

    /**
     * File extension of saved images (e.g., "bmp", "png"). Picks the encoder.
     */
    public String getImageFormat() {
        return imageFormat;
    }

    public void setImageFormat(String imageFormat) {
        if (imageFormat == null || imageFormat.trim().isEmpty()) {
            throw new IllegalArgumentException("Image format must not be empty");
        }
        String format = imageFormat.trim().toLowerCase();
        this.imageFormat = format.startsWith(".") ? format.substring(1) : format;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public void setWorkerCount(int workerCount) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("Worker count must be at least 1: " + workerCount);
        }
        this.workerCount = workerCount;
    }

    public int getShiftOffset() {
        return shiftOffset;
    }

    public void setShiftOffset(int shiftOffset) {
        this.shiftOffset = shiftOffset;
    }

    public StrategyType getStrategy() {
        return strategy;
    }

    public void setStrategy(StrategyType strategy) {
        if (strategy == null) {
            throw new IllegalArgumentException("Strategy must not be null");
        }
        this.strategy = strategy;
    }

    /**
     * When true the last partition also takes the trailing columns/rows
     * that integer division would otherwise leave unassigned.
     */
    public boolean isCoverRemainder() {
        return coverRemainder;
    }

    public void setCoverRemainder(boolean coverRemainder) {
        this.coverRemainder = coverRemainder;
    }

    @Override
    public String toString() {
        return "RunConfiguration[strategy=" + strategy.getLabel() + ", workers=" + workerCount
            + ", shift=" + shiftOffset + ", coverRemainder=" + coverRemainder
            + ", saveDirectory=" + saveDirectory + ", logFile=" + logFile + ", format=" + imageFormat + "]";
    }
}
