package com.codeflag.scheduler.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/** Queue names shared with the feeder, bound from {@code codeflag.queues.*}. */
@ConfigurationProperties("codeflag.queues")
public record QueueProperties(
        @DefaultValue("execution_tasks")   String tasks,
        @DefaultValue("execution_results") String results
) {}
