package com.example.accessmanager.application;

/**
 * Measures elapsed wall time of report steps for the progress log.
 */
public final class StepTimer {
    private final long startNanos;

    private StepTimer(long startNanos) {
        this.startNanos = startNanos;
    }

    public static StepTimer start() {
        return new StepTimer(System.nanoTime());
    }

    public double elapsedSeconds() {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }
}
