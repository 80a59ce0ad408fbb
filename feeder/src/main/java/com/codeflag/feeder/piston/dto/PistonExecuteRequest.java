package com.codeflag.feeder.piston.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Request body for POST /execute.
 *
 * Memory limits are in bytes and left out entirely when unlimited; the
 * engine then applies its own ceiling.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PistonExecuteRequest(
        String language,
        String version,
        List<PistonFile> files,
        Integer compile_timeout,
        Integer run_timeout,
        Long compile_memory_limit,
        Long run_memory_limit
) {
    private static final long BYTES_PER_MB = 1024L * 1024L;

    /**
     * @param memoryLimitMb negative means unlimited
     */
    public static PistonExecuteRequest of(String language, String version, String code,
                                          int compileTimeout, int runTimeout, int memoryLimitMb) {
        Long memoryBytes = memoryLimitMb >= 0 ? memoryLimitMb * BYTES_PER_MB : null;
        return new PistonExecuteRequest(language, version, List.of(new PistonFile(code)),
                compileTimeout, runTimeout, memoryBytes, memoryBytes);
    }
}
