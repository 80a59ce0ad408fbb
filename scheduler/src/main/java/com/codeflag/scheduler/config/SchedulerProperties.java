package com.codeflag.scheduler.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Scheduler settings, bound from {@code codeflag.scheduler.*}.
 *
 * @param executionTimeout      how long a submission waits for its result before answering 504
 * @param encryptionKey         Fernet key for settings tokens; blank = unconfigured
 * @param signatureKey          HMAC key for flags; blank = unconfigured
 * @param settingsTtl           maximum settings token age; zero disables the check
 * @param brokerConnectAttempts startup connection attempts before giving up (submissions then get 503)
 * @param brokerBackoff         base delay of the exponential connect backoff
 */
@ConfigurationProperties("codeflag.scheduler")
public record SchedulerProperties(
        @DefaultValue("60s")  Duration executionTimeout,
        String                         encryptionKey,
        String                         signatureKey,
        @DefaultValue("0s")   Duration settingsTtl,
        @DefaultValue("10")   int      brokerConnectAttempts,
        @DefaultValue("1s")   Duration brokerBackoff
) {}
