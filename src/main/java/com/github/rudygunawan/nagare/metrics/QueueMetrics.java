package com.github.rudygunawan.nagare.metrics;

/**
 * Interface for queues to provide metrics data to {@link MicrometerQueueMetrics}.
 */
public interface QueueMetrics {

    /**
     * Returns the number of tasks or items waiting to start.
     */
    int pending();

    /**
     * Returns the number of tasks currently running.
     */
    int active();

    long completedCount();

    long failedCount();
}
