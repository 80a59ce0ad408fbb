package com.codeflag.feeder.piston.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response from POST /execute.
 * {@code compile} is absent for interpreted languages; {@code run} is absent
 * when compilation failed.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PistonExecuteResponse(
        String language,
        String version,
        Stage compile,
        Stage run
) {
    /**
     * Output of one stage. {@code code} is null when the process was killed,
     * in which case {@code signal} names the signal.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Stage(
            String stdout,
            String stderr,
            String output,
            Integer code,
            String signal
    ) {
        public boolean exitedCleanly() {
            return code != null && code == 0;
        }
    }
}
