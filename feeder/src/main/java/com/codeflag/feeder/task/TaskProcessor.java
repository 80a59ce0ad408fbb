package com.codeflag.feeder.task;

import com.codeflag.common.message.ResultMessage;
import com.codeflag.common.message.ResultStatus;
import com.codeflag.feeder.config.FeederProperties;
import com.codeflag.feeder.piston.PistonClient;
import com.codeflag.feeder.piston.PistonException;
import com.codeflag.feeder.piston.dto.PistonExecuteRequest;
import com.codeflag.feeder.piston.dto.PistonExecuteResponse;
import com.codeflag.feeder.piston.dto.PistonRuntime;
import com.codeflag.feeder.runtime.RuntimeRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * Turns one task body into exactly one result. Never throws.
 *
 * Steps:
 *  1. Parse the body; unreadable → feeder_error with no job ID
 *  2. Require job_id, code and language; coerce limit overrides, falling back to defaults
 *  3. Resolve the language's engine runtime; unknown → unsupported_language
 *  4. Call the engine with an HTTP timeout of compile + run timeout plus a margin
 *  5. On 429, retry up to the cap with linearly growing waits
 *  6. Map the engine response (or failure) to a result
 *
 * Anything unexpected along the way becomes feeder_processing_error.
 */
@Component
public class TaskProcessor {

    private static final Logger log = LoggerFactory.getLogger(TaskProcessor.class);

    private static final String UNKNOWN_LANGUAGE = "unknown";

    private final PistonClient     piston;
    private final RuntimeRegistry  runtimes;
    private final ObjectMapper     json;
    private final MeterRegistry    meterRegistry;
    private final FeederProperties props;

    public TaskProcessor(PistonClient piston,
                         RuntimeRegistry runtimes,
                         ObjectMapper objectMapper,
                         MeterRegistry meterRegistry,
                         FeederProperties props) {
        this.piston        = piston;
        this.runtimes      = runtimes;
        this.json          = objectMapper;
        this.meterRegistry = meterRegistry;
        this.props         = props;
    }

    public ResultMessage process(byte[] body) {
        JsonNode task;
        try {
            task = json.readTree(body);
        } catch (IOException e) {
            log.error("Failed to decode JSON message: {}", new String(body, StandardCharsets.UTF_8), e);
            return undecodable();
        }
        if (task == null || !task.isObject()) {
            log.error("Task message is not a JSON object: {}", new String(body, StandardCharsets.UTF_8));
            return undecodable();
        }

        String jobId    = text(task, "job_id");
        String language = text(task, "language");
        if (jobId != null) {
            MDC.put("jobId", jobId);
        }
        if (language != null) {
            MDC.put("language", language);
        }
        try {
            return run(task, jobId, language);
        } catch (RuntimeException e) {
            log.error("Unexpected error while processing job ID {}", jobId, e);
            return ResultMessage.failure(jobId, orUnknown(language), ResultStatus.FEEDER_PROCESSING_ERROR,
                    "Feeder processing error: " + e, String.valueOf(e.getMessage()));
        } finally {
            MDC.remove("jobId");
            MDC.remove("language");
        }
    }

    private ResultMessage run(JsonNode task, String jobId, String language) {
        String code = text(task, "code");
        if (isBlank(jobId) || isBlank(code) || isBlank(language)) {
            log.warn("Received invalid message format. Missing job_id, code, or language (job ID: {})", jobId);
            return ResultMessage.failure(jobId, orUnknown(language), ResultStatus.FEEDER_ERROR,
                    "Feeder internal error: Missing job_id, code, or language.", "Invalid message format.");
        }

        int memoryLimit    = intOrDefault(task, "memory_limit",    props.defaultMemoryLimit());
        int compileTimeout = intOrDefault(task, "compile_timeout", props.defaultCompileTimeout());
        int runTimeout     = intOrDefault(task, "run_timeout",     props.defaultRunTimeout());

        Optional<PistonRuntime> runtime = runtimes.resolve(language);
        if (runtime.isEmpty()) {
            log.warn("Unsupported language '{}' for job ID {}", language, jobId);
            return ResultMessage.failure(jobId, language, ResultStatus.UNSUPPORTED_LANGUAGE,
                    "Unsupported language: " + language,
                    "Language '" + language + "' is not supported by the execution engine.");
        }

        String engineLanguage = runtime.get().language();
        String version        = runtime.get().version();
        PistonExecuteRequest request = PistonExecuteRequest.of(engineLanguage, version, code,
                compileTimeout, runTimeout, memoryLimit);
        Duration timeout = Duration.ofMillis((long) Math.max(0, compileTimeout) + Math.max(0, runTimeout))
                .plus(props.requestMargin());
        log.info("Executing job ID {} on {}-{} (memory={}MB, compile={}ms, run={}ms)",
                jobId, engineLanguage, version, memoryLimit, compileTimeout, runTimeout);

        return execute(jobId, language, request, timeout);
    }

    // ------------------------------------------------------------------
    // Engine call and rate-limit retry
    // ------------------------------------------------------------------

    private ResultMessage execute(String jobId, String language, PistonExecuteRequest request, Duration timeout) {
        try {
            return toResult(jobId, language, call(request, timeout));
        } catch (PistonException e) {
            if (e.getKind() == PistonException.Kind.RATE_LIMITED) {
                return retryRateLimited(jobId, language, request, timeout);
            }
            return engineFailure(jobId, language, e);
        }
    }

    private ResultMessage retryRateLimited(String jobId, String language,
                                           PistonExecuteRequest request, Duration timeout) {
        int maxRetries = props.rateLimitMaxRetries();
        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            Duration wait = props.rateLimitBackoff().multipliedBy(attempt);
            log.warn("Rate limited for job ID {}; retry {}/{} in {} ms", jobId, attempt, maxRetries, wait.toMillis());
            sleep(wait);
            try {
                return toResult(jobId, language, call(request, timeout));
            } catch (PistonException e) {
                if (e.getKind() != PistonException.Kind.RATE_LIMITED) {
                    log.error("Execution engine error while retrying job ID {}: {}", jobId, e.getMessage());
                    return ResultMessage.failure(jobId, language, ResultStatus.PISTON_API_ERROR_RETRY,
                            "Execution engine error during rate-limit retry: " + e.getMessage(), e.getMessage());
                }
            }
        }
        log.error("Giving up on job ID {} after {} rate-limited retries", jobId, maxRetries);
        return ResultMessage.failure(jobId, language, ResultStatus.PISTON_RATE_LIMITED,
                "Execution engine rate limit persisted after " + maxRetries + " retries.",
                "Rate limited by execution engine.");
    }

    private PistonExecuteResponse call(PistonExecuteRequest request, Duration timeout) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            return piston.execute(request, timeout);
        } finally {
            sample.stop(meterRegistry.timer("codeflag.piston.duration"));
        }
    }

    // ------------------------------------------------------------------
    // Result mapping
    // ------------------------------------------------------------------

    static ResultMessage toResult(String jobId, String language, PistonExecuteResponse response) {
        PistonExecuteResponse.Stage compile = response.compile();
        PistonExecuteResponse.Stage run     = response.run();

        String status  = run != null && run.exitedCleanly() ? ResultStatus.SUCCESS : ResultStatus.ERROR;
        String message = firstNonEmpty(
                run     != null ? run.signal()     : null,
                compile != null ? compile.stderr() : null,
                run     != null ? run.stderr()     : null);

        return new ResultMessage(
                jobId,
                run     != null ? run.stdout()     : null,
                run     != null ? run.stderr()     : null,
                compile != null ? compile.output() : null,
                compile != null ? compile.stderr() : null,
                language,
                response.version(),
                status,
                message,
                false);
    }

    private static ResultMessage engineFailure(String jobId, String language, PistonException e) {
        log.error("Execution engine call failed for job ID {}: {}", jobId, e.getMessage());
        return switch (e.getKind()) {
            case TIMEOUT -> ResultMessage.failure(jobId, language, ResultStatus.PISTON_TIMEOUT,
                    "Execution engine request timed out.", e.getMessage());
            case CONNECTION -> ResultMessage.failure(jobId, language, ResultStatus.PISTON_CONNECTION_ERROR,
                    "Could not reach execution engine: " + e.getMessage(), e.getMessage());
            case HTTP_STATUS -> ResultMessage.failure(jobId, language, ResultStatus.httpError(e.getStatusCode()),
                    "Execution engine returned HTTP " + e.getStatusCode() + ".", e.getMessage());
            case RESPONSE -> ResultMessage.failure(jobId, language, ResultStatus.PISTON_RESPONSE_ERROR,
                    "Execution engine returned an unreadable response.", e.getMessage());
            case RATE_LIMITED -> ResultMessage.failure(jobId, language, ResultStatus.PISTON_RATE_LIMITED,
                    "Rate limited by execution engine.", e.getMessage());
        };
    }

    private static ResultMessage undecodable() {
        return ResultMessage.failure(null, UNKNOWN_LANGUAGE, ResultStatus.FEEDER_ERROR,
                "Feeder internal error: Failed to decode message.", "Invalid message format.");
    }

    // ------------------------------------------------------------------
    // Field helpers
    // ------------------------------------------------------------------

    private static String text(JsonNode task, String field) {
        JsonNode value = task.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        return value.asText();
    }

    /** Numbers are truncated, numeric strings parsed; anything else, or out of int range, yields the default. */
    private static int intOrDefault(JsonNode task, String field, int defaultValue) {
        JsonNode value = task.get(field);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (value.isNumber()) {
            if (!value.canConvertToInt()) {
                log.warn("Ignoring out-of-range {}={}; using default {}", field, value, defaultValue);
                return defaultValue;
            }
            return value.intValue();
        }
        if (value.isTextual()) {
            try {
                return Integer.parseInt(value.asText().trim());
            } catch (NumberFormatException e) {
                log.warn("Ignoring non-numeric {}='{}'; using default {}", field, value.asText(), defaultValue);
                return defaultValue;
            }
        }
        log.warn("Ignoring {} of type {}; using default {}", field, value.getNodeType(), defaultValue);
        return defaultValue;
    }

    private static String firstNonEmpty(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isEmpty()) {
                return candidate;
            }
        }
        return null;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String orUnknown(String language) {
        return isBlank(language) ? UNKNOWN_LANGUAGE : language;
    }

    private static void sleep(Duration wait) {
        try {
            Thread.sleep(wait.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted during rate-limit backoff", e);
        }
    }
}
