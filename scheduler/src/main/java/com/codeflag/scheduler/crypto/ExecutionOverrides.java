package com.codeflag.scheduler.crypto;

/**
 * Per-job limits recovered from a settings token. A null field was not set
 * and is left to the feeder's defaults.
 *
 * @param memoryLimit    MB, -1 = unlimited
 * @param compileTimeout milliseconds
 * @param runTimeout     milliseconds
 */
public record ExecutionOverrides(Integer memoryLimit, Integer compileTimeout, Integer runTimeout) {

    private static final ExecutionOverrides NONE = new ExecutionOverrides(null, null, null);

    public static ExecutionOverrides none() {
        return NONE;
    }
}
