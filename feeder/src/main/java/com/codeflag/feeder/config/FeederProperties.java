package com.codeflag.feeder.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Feeder settings, bound from {@code codeflag.feeder.*}.
 *
 * @param pistonUrl             execution engine base URL, without a trailing slash
 * @param defaultMemoryLimit    MB; negative means unlimited
 * @param defaultCompileTimeout ms, used when a task carries no usable value
 * @param defaultRunTimeout     ms, used when a task carries no usable value
 * @param prefetch              tasks in flight at once
 * @param requestMargin         added to compile + run timeout to get the engine HTTP timeout
 * @param rateLimitMaxRetries   retries after the first 429 before giving up
 * @param rateLimitBackoff      retry n waits n times this
 * @param runtimeFetchAttempts  startup attempts to load the runtime list
 * @param runtimeFetchBackoff   base delay between those attempts, doubled each time
 * @param brokerConnectAttempts startup connection attempts before exiting
 * @param brokerBackoff         base delay of the exponential connect backoff
 */
@ConfigurationProperties("codeflag.feeder")
public record FeederProperties(
        @DefaultValue("http://localhost:2000") String   pistonUrl,
        @DefaultValue("-1")                    int      defaultMemoryLimit,
        @DefaultValue("10000")                 int      defaultCompileTimeout,
        @DefaultValue("10000")                 int      defaultRunTimeout,
        @DefaultValue("5")                     int      prefetch,
        @DefaultValue("10s")                   Duration requestMargin,
        @DefaultValue("10")                    int      rateLimitMaxRetries,
        @DefaultValue("1s")                    Duration rateLimitBackoff,
        @DefaultValue("5")                     int      runtimeFetchAttempts,
        @DefaultValue("1s")                    Duration runtimeFetchBackoff,
        @DefaultValue("5")                     int      brokerConnectAttempts,
        @DefaultValue("1s")                    Duration brokerBackoff
) {}
