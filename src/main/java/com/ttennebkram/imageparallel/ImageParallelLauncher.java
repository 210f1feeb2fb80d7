package com.ttennebkram.imageparallel;

import com.ttennebkram.imageparallel.config.RunConfiguration;
import com.ttennebkram.imageparallel.config.RunConfigurationSerializer;
import com.ttennebkram.imageparallel.io.CsvTimingLog;
import com.ttennebkram.imageparallel.io.OpenCvImageStore;
import com.ttennebkram.imageparallel.io.TimingRecord;
import com.ttennebkram.imageparallel.processing.StageReport;
import com.ttennebkram.imageparallel.processing.strategies.StrategyType;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.LogManager;

/**
 * Command line entry point.
 *
 * <pre>
 * image-parallel &lt;image&gt; [--strategy NAME|all] [--workers N] [--shift N]
 *                [--config file.json] [--cover-remainder]
 * </pre>
 */
public class ImageParallelLauncher {

    private static final String USAGE = "Usage: image-parallel <image> [--strategy NAME|all] [--workers N] "
        + "[--shift N] [--config file.json] [--cover-remainder]";

    public static void main(String[] args) {
        loadLoggingConfiguration();

        try {
            Invocation invocation = parseArguments(args);

            // Load OpenCV native library
            OpenCvImageStore.loadNativeLibrary();

            RunConfiguration config = invocation.config;
            TransformationSession session = new TransformationSession(config, new OpenCvImageStore(),
                new CsvTimingLog(config.getLogFile()));
            session.load(invocation.imagePath);

            for (StrategyType type : invocation.strategies) {
                TimingRecord record = session.apply(type);
                System.out.println(type.getLabel() + ": " + record.getDurationMillis() + " ms -> " + record.getOutputPath());
                for (StageReport report : session.getLastResult().getStageReports()) {
                    System.out.println("    " + report);
                }
            }
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            System.exit(2);
        } catch (IOException e) {
            System.err.println("I/O error: " + e.getMessage());
            System.exit(1);
        }
    }

    /**
     * Parsed command line.
     */
    static final class Invocation {
        final Path imagePath;
        final RunConfiguration config;
        final List<StrategyType> strategies;

        Invocation(Path imagePath, RunConfiguration config, List<StrategyType> strategies) {
            this.imagePath = imagePath;
            this.config = config;
            this.strategies = strategies;
        }
    }

    /**
     * Parse arguments. Command line options override values from --config.
     *
     * @throws IllegalArgumentException on unknown options or bad values
     * @throws IOException              if the config file cannot be read
     */
    static Invocation parseArguments(String[] args) throws IOException {
        Path imagePath = null;
        Path configPath = null;
        String strategyName = null;
        Integer workers = null;
        Integer shift = null;
        boolean coverRemainder = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--strategy":
                    strategyName = requireValue(args, ++i, arg);
                    break;
                case "--workers":
                    workers = parseInt(requireValue(args, ++i, arg), arg);
                    break;
                case "--shift":
                    shift = parseInt(requireValue(args, ++i, arg), arg);
                    break;
                case "--config":
                    configPath = Paths.get(requireValue(args, ++i, arg));
                    break;
                case "--cover-remainder":
                    coverRemainder = true;
                    break;
                default:
                    if (arg.startsWith("--") || imagePath != null) {
                        throw new IllegalArgumentException("Unexpected argument: " + arg);
                    }
                    imagePath = Paths.get(arg);
            }
        }
        if (imagePath == null) {
            throw new IllegalArgumentException("No image given");
        }

        RunConfiguration config = configPath != null
            ? RunConfigurationSerializer.load(configPath)
            : new RunConfiguration();
        if (workers != null) {
            config.setWorkerCount(workers);
        }
        if (shift != null) {
            config.setShiftOffset(shift);
        }
        if (coverRemainder) {
            config.setCoverRemainder(true);
        }

        List<StrategyType> strategies = new ArrayList<>();
        if ("all".equalsIgnoreCase(strategyName)) {
            strategies.addAll(Arrays.asList(StrategyType.values()));
        } else {
            if (strategyName != null) {
                config.setStrategy(StrategyType.fromLabel(strategyName));
            }
            strategies.add(config.getStrategy());
        }
        return new Invocation(imagePath, config, strategies);
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException(option + " needs a value");
        }
        return args[index];
    }

    private static int parseInt(String value, String option) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(option + " expects a number, got '" + value + "'", e);
        }
    }

    private static void loadLoggingConfiguration() {
        try (InputStream in = ImageParallelLauncher.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("[ImageParallelLauncher] Could not read logging.properties: " + e.getMessage());
        }
    }
}
