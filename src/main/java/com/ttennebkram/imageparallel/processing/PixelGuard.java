package com.ttennebkram.imageparallel.processing;

/**
 * Runs a single pixel read-modify-write.
 * Kernels route every pixel through a guard so a strategy can decide
 * whether the operation needs mutual exclusion.
 */
@FunctionalInterface
public interface PixelGuard {

    /**
     * One atomic unit of kernel work at (x, y).
     */
    @FunctionalInterface
    interface PixelOperation {
        void apply(int x, int y);
    }

    /** Runs the operation directly, for buffers owned by a single thread */
    PixelGuard UNGUARDED = (op, x, y) -> op.apply(x, y);

    void run(PixelOperation op, int x, int y);

    /**
     * Guard that runs every operation while holding the monitor of {@code lock}.
     */
    static PixelGuard lockingOn(Object lock) {
        return (op, x, y) -> {
            synchronized (lock) {
                op.apply(x, y);
            }
        };
    }
}
