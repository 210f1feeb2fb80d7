package com.ttennebkram.imageparallel.processing.strategies;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Selector for the available execution strategies.
 * The label is what shows up in timing logs and output file names.
 */
public enum StrategyType {

    SEQUENTIAL("Sequential") {
        @Override
        public ExecutionStrategy create(int workerCount, boolean coverRemainder) {
            return new SequentialStrategy();
        }
    },
    SHARED_LOCKED_PARALLEL("SharedLockedParallel") {
        @Override
        public ExecutionStrategy create(int workerCount, boolean coverRemainder) {
            return new SharedLockedParallelStrategy(workerCount, coverRemainder);
        }
    },
    CLONE_MERGE_PARALLEL("CloneMergeParallel") {
        @Override
        public ExecutionStrategy create(int workerCount, boolean coverRemainder) {
            return new CloneMergeParallelStrategy(workerCount, coverRemainder);
        }
    },
    SNAPSHOT_PARALLEL("SnapshotParallel") {
        @Override
        public ExecutionStrategy create(int workerCount, boolean coverRemainder) {
            return new SnapshotParallelStrategy(workerCount, coverRemainder);
        }
    };

    private final String label;

    StrategyType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Create a strategy instance. Sequential ignores both parameters.
     */
    public abstract ExecutionStrategy create(int workerCount, boolean coverRemainder);

    /**
     * Look up a strategy by label or constant name, ignoring case.
     *
     * @throws IllegalArgumentException if nothing matches
     */
    public static StrategyType fromLabel(String name) {
        if (name != null) {
            String trimmed = name.trim();
            for (StrategyType type : values()) {
                if (type.label.equalsIgnoreCase(trimmed) || type.name().equalsIgnoreCase(trimmed)) {
                    return type;
                }
            }
        }
        String known = Arrays.stream(values()).map(StrategyType::getLabel).collect(Collectors.joining(", "));
        throw new IllegalArgumentException("Unknown strategy '" + name + "', expected one of: " + known);
    }
}
