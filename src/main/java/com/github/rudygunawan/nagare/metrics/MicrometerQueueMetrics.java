package com.github.rudygunawan.nagare.metrics;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.util.Collections;

/**
 * Binds the counters of a {@link QueueMetrics} source to a MeterRegistry.
 *
 * <p>Exposes, tagged with {@code queue=<name>}:
 * <ul>
 *   <li>queue.pending - Tasks or items waiting to start
 *   <li>queue.active - Tasks currently running
 *   <li>queue.tasks - Settled tasks, tagged {@code result=success|failure}
 * </ul>
 */
public class MicrometerQueueMetrics implements MeterBinder {

    private final QueueMetrics queue;
    private final String queueName;
    private final Iterable<Tag> tags;

    public MicrometerQueueMetrics(QueueMetrics queue, String queueName, Iterable<Tag> tags) {
        this.queue = queue;
        this.queueName = queueName;
        this.tags = tags;
    }

    public static <Q extends QueueMetrics> Q monitor(MeterRegistry registry, Q queue, String queueName) {
        return monitor(registry, queue, queueName, Collections.emptyList());
    }

    public static <Q extends QueueMetrics> Q monitor(MeterRegistry registry, Q queue, String queueName,
                                                     Iterable<Tag> tags) {
        new MicrometerQueueMetrics(queue, queueName, tags).bindTo(registry);
        return queue;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Tags allTags = Tags.of("queue", queueName).and(tags);

        Gauge.builder("queue.pending", queue, QueueMetrics::pending)
                .tags(allTags)
                .description("Number of tasks waiting to start")
                .register(registry);

        Gauge.builder("queue.active", queue, QueueMetrics::active)
                .tags(allTags)
                .description("Number of running tasks")
                .register(registry);

        FunctionCounter.builder("queue.tasks", queue, QueueMetrics::completedCount)
                .tags(allTags.and("result", "success"))
                .description("Number of tasks completed successfully")
                .register(registry);

        FunctionCounter.builder("queue.tasks", queue, QueueMetrics::failedCount)
                .tags(allTags.and("result", "failure"))
                .description("Number of failed tasks")
                .register(registry);
    }
}
