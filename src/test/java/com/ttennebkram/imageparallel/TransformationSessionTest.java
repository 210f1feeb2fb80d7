package com.ttennebkram.imageparallel;

import com.ttennebkram.imageparallel.config.RunConfiguration;
import com.ttennebkram.imageparallel.io.ImageStore;
import com.ttennebkram.imageparallel.io.TimingLog;
import com.ttennebkram.imageparallel.io.TimingRecord;
import com.ttennebkram.imageparallel.model.PixelBuffer;
import com.ttennebkram.imageparallel.processing.PipelineRunner;
import com.ttennebkram.imageparallel.processing.strategies.CloneMergeParallelStrategy;
import com.ttennebkram.imageparallel.processing.strategies.SequentialStrategy;
import com.ttennebkram.imageparallel.processing.strategies.StrategyType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TransformationSessionTest {

    /** Image store keeping buffers in memory */
    private static class InMemoryImageStore implements ImageStore {
        final Map<Path, PixelBuffer> images = new HashMap<>();

        @Override
        public PixelBuffer load(Path path) throws IOException {
            PixelBuffer image = images.get(path);
            if (image == null) {
                throw new IOException("Image file not found: " + path);
            }
            return image.copy();
        }

        @Override
        public void save(PixelBuffer buffer, Path path) {
            images.put(path, buffer.copy());
        }
    }

    private static class InMemoryTimingLog implements TimingLog {
        final List<TimingRecord> records = new ArrayList<>();

        @Override
        public void append(TimingRecord record) {
            records.add(record);
        }
    }

    @TempDir
    Path tempDir;

    private final Clock clock = Clock.fixed(Instant.parse("2026-10-19T12:30:45Z"), ZoneOffset.UTC);
    private final Path imagePath = Paths.get("input.png");

    private InMemoryImageStore store;
    private InMemoryTimingLog log;
    private RunConfiguration config;

    @BeforeEach
    void setUp() {
        store = new InMemoryImageStore();
        store.images.put(imagePath, TestImages.random(48, 20, 11));
        log = new InMemoryTimingLog();

        config = new RunConfiguration();
        config.setSaveDirectory(tempDir.resolve("SavedImages"));
        config.setWorkerCount(4);
        config.setShiftOffset(5);
    }

    @Test
    void createsSaveDirectory() throws IOException {
        new TransformationSession(config, store, log, clock);
        assertTrue(Files.isDirectory(config.getSaveDirectory()));
    }

    @Test
    void applyBeforeLoadIsRejected() throws IOException {
        TransformationSession session = new TransformationSession(config, store, log, clock);
        assertThrows(IllegalStateException.class, () -> session.apply(StrategyType.SEQUENTIAL));
        assertTrue(log.records.isEmpty());
    }

    @Test
    void applySavesOutputAndLogsTiming() throws IOException {
        TransformationSession session = new TransformationSession(config, store, log, clock);
        PixelBuffer original = session.load(imagePath);

        TimingRecord record = session.apply(StrategyType.SEQUENTIAL);

        Path expectedPath = config.getSaveDirectory().resolve("Sequential_20261019123045.bmp");
        assertEquals(expectedPath, record.getOutputPath());
        assertEquals(LocalDateTime.of(2026, 10, 19, 12, 30, 45), record.getTimestamp());
        assertEquals(48, record.getWidth());
        assertEquals(20, record.getHeight());
        assertEquals("Sequential", record.getTransformation());
        assertEquals(session.getLastResult().getTotalMillis(), record.getDurationMillis());

        PixelBuffer expected = PipelineRunner.standard(5).run(original, new SequentialStrategy()).getOutput();
        assertEquals(expected, store.images.get(expectedPath));
        assertEquals(1, log.records.size());
        assertSame(record, log.records.get(0));
    }

    @Test
    void everyApplyStartsFromTheLoadedImage() throws IOException {
        TransformationSession session = new TransformationSession(config, store, log, clock);
        PixelBuffer original = session.load(imagePath).copy();

        session.apply(StrategyType.CLONE_MERGE_PARALLEL);
        session.apply(StrategyType.SHARED_LOCKED_PARALLEL);
        session.apply(StrategyType.CLONE_MERGE_PARALLEL);

        assertEquals(original, session.getOriginalImage());
        assertEquals(3, log.records.size());
        assertEquals("CloneMergeParallel", log.records.get(0).getTransformation());
        assertEquals("SharedLockedParallel", log.records.get(1).getTransformation());

        PixelBuffer expected = PipelineRunner.standard(5).run(original, new CloneMergeParallelStrategy(4)).getOutput();
        assertEquals(expected, store.images.get(log.records.get(2).getOutputPath()));
    }

    @Test
    void applyUsesConfiguredStrategyAndFormat() throws IOException {
        config.setStrategy(StrategyType.SNAPSHOT_PARALLEL);
        config.setImageFormat("png");
        TransformationSession session = new TransformationSession(config, store, log, clock);
        session.load(imagePath);

        TimingRecord record = session.apply();

        assertEquals("SnapshotParallel", record.getTransformation());
        assertEquals("SnapshotParallel_20261019123045.png", record.getOutputPath().getFileName().toString());
    }

    @Test
    void configChangesApplyToLaterRuns() throws IOException {
        TransformationSession session = new TransformationSession(config, store, log, clock);
        PixelBuffer original = session.load(imagePath).copy();

        config.setShiftOffset(17);
        config.setWorkerCount(3);
        TimingRecord record = session.apply(StrategyType.CLONE_MERGE_PARALLEL);

        PixelBuffer expected = PipelineRunner.standard(17).run(original, new CloneMergeParallelStrategy(3)).getOutput();
        assertEquals(expected, store.images.get(record.getOutputPath()));
    }

    @Test
    void loadFailurePropagates() throws IOException {
        TransformationSession session = new TransformationSession(config, store, log, clock);
        assertThrows(IOException.class, () -> session.load(Paths.get("missing.png")));

        store.images.put(Paths.get("empty.png"), new PixelBuffer(0, 0));
        assertThrows(IOException.class, () -> session.load(Paths.get("empty.png")));
        assertNull(session.getOriginalImage());
    }
}
