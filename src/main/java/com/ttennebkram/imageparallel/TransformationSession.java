package com.ttennebkram.imageparallel;

import com.ttennebkram.imageparallel.config.RunConfiguration;
import com.ttennebkram.imageparallel.io.ImageStore;
import com.ttennebkram.imageparallel.io.TimingLog;
import com.ttennebkram.imageparallel.io.TimingRecord;
import com.ttennebkram.imageparallel.model.PixelBuffer;
import com.ttennebkram.imageparallel.processing.PipelineResult;
import com.ttennebkram.imageparallel.processing.PipelineRunner;
import com.ttennebkram.imageparallel.processing.strategies.ExecutionStrategy;
import com.ttennebkram.imageparallel.processing.strategies.StrategyType;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.logging.Logger;

/**
 * Ties the engine to its collaborators: load an image once, then for each applied
 * strategy transform a clone, save the result and append a timing record.
 */
public class TransformationSession {

    private static final Logger LOG = Logger.getLogger(TransformationSession.class.getName());

    private static final DateTimeFormatter FILE_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private final RunConfiguration config;
    private final ImageStore imageStore;
    private final TimingLog timingLog;
    private final Clock clock;

    private PixelBuffer originalImage;
    private PipelineResult lastResult;

    public TransformationSession(RunConfiguration config, ImageStore imageStore, TimingLog timingLog) throws IOException {
        this(config, imageStore, timingLog, Clock.systemDefaultZone());
    }

    /**
     * @throws IOException if the save directory cannot be created
     */
    public TransformationSession(RunConfiguration config, ImageStore imageStore, TimingLog timingLog,
                                 Clock clock) throws IOException {
        this.config = config;
        this.imageStore = imageStore;
        this.timingLog = timingLog;
        this.clock = clock;
        Files.createDirectories(config.getSaveDirectory());
    }

    public RunConfiguration getConfig() {
        return config;
    }

    /**
     * Decode the image every later {@link #apply} starts from.
     */
    public PixelBuffer load(Path imagePath) throws IOException {
        PixelBuffer image = imageStore.load(imagePath);
        if (image.isEmpty()) {
            throw new IOException("Image has no pixels: " + imagePath);
        }
        originalImage = image;
        LOG.info(() -> "[TransformationSession] Loaded " + imagePath + " (" + image.getWidth() + "x" + image.getHeight() + ")");
        return image;
    }

    public PixelBuffer getOriginalImage() {
        return originalImage;
    }

    /**
     * The result of the most recent {@link #apply}, or null.
     */
    public PipelineResult getLastResult() {
        return lastResult;
    }

    /**
     * Apply the configured strategy.
     */
    public TimingRecord apply() throws IOException {
        return apply(config.getStrategy());
    }

    /**
     * Run the pipeline with the given strategy on a clone of the loaded image,
     * save the output and log the timing. Worker count, shift offset and
     * remainder handling are read from the configuration on every call.
     *
     * @throws IllegalStateException if no image has been loaded
     */
    public TimingRecord apply(StrategyType type) throws IOException {
        if (originalImage == null) {
            throw new IllegalStateException("Please load an image first.");
        }

        ExecutionStrategy strategy = type.create(config.getWorkerCount(), config.isCoverRemainder());
        PipelineResult result = PipelineRunner.standard(config.getShiftOffset()).run(originalImage, strategy);
        lastResult = result;

        LocalDateTime now = LocalDateTime.now(clock);
        String fileName = type.getLabel() + "_" + FILE_TIME_FORMAT.format(now) + "." + config.getImageFormat();
        Path outputPath = config.getSaveDirectory().resolve(fileName);
        imageStore.save(result.getOutput(), outputPath);

        TimingRecord record = new TimingRecord(now, result.getOutput().getWidth(), result.getOutput().getHeight(),
            type.getLabel(), result.getTotalMillis(), outputPath);
        timingLog.append(record);
        return record;
    }
}
