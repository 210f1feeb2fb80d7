package com.ttennebkram.imageparallel.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Collections;
import java.util.List;

/**
 * Timing log stored as a semicolon separated file.
 * The header is written once when the file is first created; existing files are only appended to.
 */
public class CsvTimingLog implements TimingLog {

    private final Path path;

    /**
     * @throws IOException if the file or its directory cannot be created
     */
    public CsvTimingLog(Path path) throws IOException {
        this.path = path;
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        if (!Files.exists(path)) {
            Files.write(path, Collections.singletonList(TimingRecord.CSV_HEADER), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE_NEW);
        }
    }

    public Path getPath() {
        return path;
    }

    @Override
    public synchronized void append(TimingRecord record) throws IOException {
        Files.write(path, Collections.singletonList(record.toCsvLine()), StandardCharsets.UTF_8,
            StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    /**
     * All data lines, without the header, in the order they were appended.
     */
    public List<String> readRecords() throws IOException {
        List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        if (!lines.isEmpty() && lines.get(0).equals(TimingRecord.CSV_HEADER)) {
            return lines.subList(1, lines.size());
        }
        return lines;
    }
}
