package com.codeflag.common.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of a message on the task queue (scheduler → feeder).
 *
 * The three limits are optional: the scheduler omits the ones the caller's
 * settings did not set, and the feeder fills them from its own defaults.
 * memory_limit is in MB (-1 = unlimited), timeouts in milliseconds.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskMessage(
        @JsonProperty("job_id")          String  jobId,
        @JsonProperty("code")            String  code,
        @JsonProperty("language")        String  language,
        @JsonProperty("memory_limit")    Integer memoryLimit,
        @JsonProperty("compile_timeout") Integer compileTimeout,
        @JsonProperty("run_timeout")     Integer runTimeout
) {
}
