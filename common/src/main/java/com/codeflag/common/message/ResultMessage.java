package com.codeflag.common.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of a message on the results queue (feeder → scheduler).
 *
 * Every field is always serialized, nulls included, so consumers can rely on
 * the shape. {@code fail} is true for every status other than
 * {@link ResultStatus#SUCCESS} and {@link ResultStatus#ERROR}: a program that
 * ran and exited non-zero is a completed execution, not a pipeline failure.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResultMessage(
        @JsonProperty("job_id")         String  jobId,
        @JsonProperty("stdout")         String  stdout,
        @JsonProperty("stderr")         String  stderr,
        @JsonProperty("compile_output") String  compileOutput,
        @JsonProperty("compile_stderr") String  compileStderr,
        @JsonProperty("language")       String  language,
        @JsonProperty("version")        String  version,
        @JsonProperty("status")         String  status,
        @JsonProperty("message")        String  message,
        @JsonProperty("fail")           boolean fail
) {
    /**
     * A result for a job that never produced engine output.
     *
     * @param jobId    may be null when the task body could not be parsed
     * @param language the declared language, or "unknown"
     */
    public static ResultMessage failure(String jobId, String language, String status,
                                        String stderr, String message) {
        return new ResultMessage(jobId, null, stderr, null, null,
                language, null, status, message, true);
    }
}
