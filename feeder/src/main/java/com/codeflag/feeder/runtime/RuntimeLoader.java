package com.codeflag.feeder.runtime;

import com.codeflag.feeder.piston.PistonClient;
import com.codeflag.feeder.piston.PistonException;
import com.codeflag.feeder.piston.dto.PistonRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Fetches the runtime list from the engine, retrying with exponential backoff.
 *
 * There is no degraded mode: without versions no task can be routed, so
 * exhausting the attempts throws and startup fails.
 */
public class RuntimeLoader {

    private static final Logger log = LoggerFactory.getLogger(RuntimeLoader.class);

    private final PistonClient piston;
    private final int          maxAttempts;
    private final Duration     baseDelay;

    public RuntimeLoader(PistonClient piston, int maxAttempts, Duration baseDelay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.piston      = piston;
        this.maxAttempts = maxAttempts;
        this.baseDelay   = baseDelay;
    }

    /**
     * @throws IllegalStateException when every attempt failed
     */
    public RuntimeRegistry load() {
        PistonException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                List<PistonRuntime> runtimes = piston.runtimes();
                RuntimeRegistry registry = RuntimeRegistry.of(runtimes);
                log.info("Loaded {} runtimes ({} names and aliases) from execution engine",
                        runtimes.size(), registry.size());
                return registry;
            } catch (PistonException e) {
                last = e;
                log.error("Attempt {}/{}: failed to fetch runtimes from execution engine - {}",
                        attempt, maxAttempts, e.getMessage());
            }
            if (attempt < maxAttempts) {
                sleep(baseDelay.multipliedBy(1L << (attempt - 1)));
            }
        }
        throw new IllegalStateException(
                "Could not load runtimes from execution engine after " + maxAttempts + " attempts", last);
    }

    private static void sleep(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting to retry runtime fetch", e);
        }
    }
}
