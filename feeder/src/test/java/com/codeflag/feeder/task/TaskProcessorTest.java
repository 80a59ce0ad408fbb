package com.codeflag.feeder.task;

import com.codeflag.common.message.ResultMessage;
import com.codeflag.common.message.ResultStatus;
import com.codeflag.feeder.config.FeederProperties;
import com.codeflag.feeder.piston.PistonClient;
import com.codeflag.feeder.piston.PistonException;
import com.codeflag.feeder.piston.dto.PistonExecuteRequest;
import com.codeflag.feeder.piston.dto.PistonExecuteResponse;
import com.codeflag.feeder.piston.dto.PistonExecuteResponse.Stage;
import com.codeflag.feeder.piston.dto.PistonRuntime;
import com.codeflag.feeder.runtime.RuntimeRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TaskProcessor.
 *
 * The engine client is mocked; registry, JSON and metrics are real. Backoff
 * is zero so the rate-limit paths run instantly.
 */
@ExtendWith(MockitoExtension.class)
class TaskProcessorTest {

    static final RuntimeRegistry RUNTIMES = RuntimeRegistry.of(List.of(
            new PistonRuntime("python", "3.10.0", List.of("py")),
            new PistonRuntime("c++", "10.2.0", List.of("cpp"))));

    @Mock PistonClient piston;

    SimpleMeterRegistry meters;
    TaskProcessor processor;

    @BeforeEach
    void setUp() {
        meters    = new SimpleMeterRegistry();
        processor = new TaskProcessor(piston, RUNTIMES, new ObjectMapper(), meters, props());
    }

    // ------------------------------------------------------------------
    // Successful executions
    // ------------------------------------------------------------------

    @Test
    void process_programPrintsHi_success() {
        when(piston.execute(any(), any())).thenReturn(response(null, run("hi\n", "", 0, null)));

        ResultMessage result = process("""
                {"job_id":"j1","code":"print(\\"hi\\")","language":"python"}
                """);

        assertThat(result.jobId()).isEqualTo("j1");
        assertThat(result.status()).isEqualTo(ResultStatus.SUCCESS);
        assertThat(result.stdout()).isEqualTo("hi\n");
        assertThat(result.stderr()).isEmpty();
        assertThat(result.language()).isEqualTo("python");
        assertThat(result.version()).isEqualTo("3.10.0");
        assertThat(result.message()).isNull();
        assertThat(result.fail()).isFalse();
        assertThat(meters.timer("codeflag.piston.duration").count()).isEqualTo(1);
    }

    @Test
    void process_nonZeroExit_errorButNotFailed() {
        when(piston.execute(any(), any())).thenReturn(response(null, run("", "Traceback\n", 1, null)));

        ResultMessage result = process(task("python"));

        assertThat(result.status()).isEqualTo(ResultStatus.ERROR);
        assertThat(result.message()).isEqualTo("Traceback\n");
        assertThat(result.fail()).isFalse();
    }

    @Test
    void process_killedBySignal_signalIsMessage() {
        when(piston.execute(any(), any())).thenReturn(response(null, run("partial", "oops", null, "SIGKILL")));

        ResultMessage result = process(task("python"));

        assertThat(result.status()).isEqualTo(ResultStatus.ERROR);
        assertThat(result.message()).isEqualTo("SIGKILL");
        assertThat(result.stdout()).isEqualTo("partial");
    }

    @Test
    void process_compileFailed_compileStderrIsMessage() {
        Stage compile = new Stage("", "main.cpp:1: error", "main.cpp:1: error", 1, null);
        when(piston.execute(any(), any())).thenReturn(response(compile, null));

        ResultMessage result = process(task("cpp"));

        assertThat(result.status()).isEqualTo(ResultStatus.ERROR);
        assertThat(result.stdout()).isNull();
        assertThat(result.compileOutput()).isEqualTo("main.cpp:1: error");
        assertThat(result.compileStderr()).isEqualTo("main.cpp:1: error");
        assertThat(result.message()).isEqualTo("main.cpp:1: error");
        assertThat(result.version()).isEqualTo("10.2.0");
    }

    // ------------------------------------------------------------------
    // Request construction
    // ------------------------------------------------------------------

    @Test
    void process_noOverrides_defaultsAndAliasResolved() {
        when(piston.execute(any(), any())).thenReturn(response(null, run("", "", 0, null)));
        ArgumentCaptor<PistonExecuteRequest> request = ArgumentCaptor.forClass(PistonExecuteRequest.class);
        ArgumentCaptor<Duration> timeout = ArgumentCaptor.forClass(Duration.class);

        process(task("PY"));

        verify(piston).execute(request.capture(), timeout.capture());
        assertThat(request.getValue().version()).isEqualTo("3.10.0");
        assertThat(request.getValue().compile_timeout()).isEqualTo(10000);
        assertThat(request.getValue().run_timeout()).isEqualTo(10000);
        assertThat(request.getValue().compile_memory_limit()).isNull();
        assertThat(request.getValue().run_memory_limit()).isNull();
        assertThat(timeout.getValue()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void process_overrides_memoryConvertedToBytes() {
        when(piston.execute(any(), any())).thenReturn(response(null, run("", "", 0, null)));
        ArgumentCaptor<PistonExecuteRequest> request = ArgumentCaptor.forClass(PistonExecuteRequest.class);
        ArgumentCaptor<Duration> timeout = ArgumentCaptor.forClass(Duration.class);

        process("""
                {"job_id":"j1","code":"x","language":"python",
                 "memory_limit":256,"compile_timeout":2000,"run_timeout":"3000"}
                """);

        verify(piston).execute(request.capture(), timeout.capture());
        assertThat(request.getValue().compile_memory_limit()).isEqualTo(256L * 1024 * 1024);
        assertThat(request.getValue().run_memory_limit()).isEqualTo(256L * 1024 * 1024);
        assertThat(request.getValue().compile_timeout()).isEqualTo(2000);
        assertThat(request.getValue().run_timeout()).isEqualTo(3000);
        assertThat(timeout.getValue()).isEqualTo(Duration.ofMillis(15000));
    }

    @Test
    void process_malformedOverrides_fallBackToDefaults() {
        when(piston.execute(any(), any())).thenReturn(response(null, run("", "", 0, null)));
        ArgumentCaptor<PistonExecuteRequest> request = ArgumentCaptor.forClass(PistonExecuteRequest.class);

        ResultMessage result = process("""
                {"job_id":"j1","code":"x","language":"python",
                 "memory_limit":"lots","compile_timeout":[1],"run_timeout":2500.9}
                """);

        verify(piston).execute(request.capture(), any());
        assertThat(result.status()).isEqualTo(ResultStatus.SUCCESS);
        assertThat(request.getValue().run_memory_limit()).isNull();
        assertThat(request.getValue().compile_timeout()).isEqualTo(10000);
        assertThat(request.getValue().run_timeout()).isEqualTo(2500);
    }

    @Test
    void process_mixedCaseLanguage_sendsEngineSpelling() {
        when(piston.execute(any(), any())).thenReturn(response(null, run("", "", 0, null)));
        ArgumentCaptor<PistonExecuteRequest> request = ArgumentCaptor.forClass(PistonExecuteRequest.class);

        ResultMessage result = process(task("PYTHON"));

        verify(piston).execute(request.capture(), any());
        assertThat(request.getValue().language()).isEqualTo("python");
        assertThat(request.getValue().version()).isEqualTo("3.10.0");
        assertThat(result.status()).isEqualTo(ResultStatus.SUCCESS);
    }

    @Test
    void process_aliasLanguage_sendsRuntimeName() {
        when(piston.execute(any(), any())).thenReturn(response(null, run("", "", 0, null)));
        ArgumentCaptor<PistonExecuteRequest> request = ArgumentCaptor.forClass(PistonExecuteRequest.class);

        process(task("Cpp"));

        verify(piston).execute(request.capture(), any());
        assertThat(request.getValue().language()).isEqualTo("c++");
        assertThat(request.getValue().version()).isEqualTo("10.2.0");
    }

    @Test
    void process_overridesOutOfIntRange_fallBackToDefaults() {
        when(piston.execute(any(), any())).thenReturn(response(null, run("", "", 0, null)));
        ArgumentCaptor<PistonExecuteRequest> request = ArgumentCaptor.forClass(PistonExecuteRequest.class);

        process("""
                {"job_id":"j1","code":"x","language":"python",
                 "memory_limit":4294967808,"compile_timeout":-4294967296,"run_timeout":1e12}
                """);

        verify(piston).execute(request.capture(), any());
        assertThat(request.getValue().compile_memory_limit()).isNull();
        assertThat(request.getValue().run_memory_limit()).isNull();
        assertThat(request.getValue().compile_timeout()).isEqualTo(10000);
        assertThat(request.getValue().run_timeout()).isEqualTo(10000);
    }

    // ------------------------------------------------------------------
    // Rejected before the engine
    // ------------------------------------------------------------------

    @Test
    void process_unknownLanguage_unsupportedWithoutEngineCall() {
        ResultMessage result = process(task("brainfudge"));

        assertThat(result.status()).isEqualTo(ResultStatus.UNSUPPORTED_LANGUAGE);
        assertThat(result.fail()).isTrue();
        assertThat(result.jobId()).isEqualTo("j1");
        assertThat(result.language()).isEqualTo("brainfudge");
        verifyNoInteractions(piston);
    }

    @Test
    void process_bodyNotJson_feederErrorWithoutJobId() {
        ResultMessage result = process("{job_id: oops");

        assertThat(result.status()).isEqualTo(ResultStatus.FEEDER_ERROR);
        assertThat(result.jobId()).isNull();
        assertThat(result.language()).isEqualTo("unknown");
        assertThat(result.message()).isEqualTo("Invalid message format.");
        assertThat(result.fail()).isTrue();
        verifyNoInteractions(piston);
    }

    @Test
    void process_bodyNotObject_feederError() {
        ResultMessage result = process("[\"j1\"]");

        assertThat(result.status()).isEqualTo(ResultStatus.FEEDER_ERROR);
        assertThat(result.jobId()).isNull();
    }

    @Test
    void process_missingCode_feederErrorEchoesJobId() {
        ResultMessage result = process("{\"job_id\":\"j9\",\"language\":\"python\"}");

        assertThat(result.status()).isEqualTo(ResultStatus.FEEDER_ERROR);
        assertThat(result.jobId()).isEqualTo("j9");
        assertThat(result.stderr()).contains("Missing job_id, code, or language");
        verifyNoInteractions(piston);
    }

    // ------------------------------------------------------------------
    // Engine failures
    // ------------------------------------------------------------------

    @Test
    void process_twoRateLimitsThenOk_success() {
        when(piston.execute(any(), any()))
                .thenThrow(rateLimited())
                .thenThrow(rateLimited())
                .thenReturn(response(null, run("ok\n", "", 0, null)));

        ResultMessage result = process(task("python"));

        assertThat(result.status()).isEqualTo(ResultStatus.SUCCESS);
        assertThat(result.stdout()).isEqualTo("ok\n");
        verify(piston, times(3)).execute(any(), any());
    }

    @Test
    void process_elevenRateLimits_rateLimited() {
        when(piston.execute(any(), any())).thenThrow(rateLimited());

        ResultMessage result = process(task("python"));

        assertThat(result.status()).isEqualTo(ResultStatus.PISTON_RATE_LIMITED);
        assertThat(result.fail()).isTrue();
        verify(piston, times(11)).execute(any(), any());
    }

    @Test
    void process_otherErrorDuringRetry_apiErrorRetry() {
        when(piston.execute(any(), any()))
                .thenThrow(rateLimited())
                .thenThrow(new PistonException(PistonException.Kind.HTTP_STATUS, 502, "bad gateway", null));

        ResultMessage result = process(task("python"));

        assertThat(result.status()).isEqualTo(ResultStatus.PISTON_API_ERROR_RETRY);
        assertThat(result.message()).isEqualTo("bad gateway");
        verify(piston, times(2)).execute(any(), any());
    }

    @Test
    void process_http500_httpErrorStatus() {
        when(piston.execute(any(), any()))
                .thenThrow(new PistonException(PistonException.Kind.HTTP_STATUS, 500, "internal", null));

        ResultMessage result = process(task("python"));

        assertThat(result.status()).isEqualTo("piston_http_error_500");
        assertThat(result.fail()).isTrue();
        verify(piston, times(1)).execute(any(), any());
    }

    @Test
    void process_engineTimeout_pistonTimeoutNotRetried() {
        when(piston.execute(any(), any()))
                .thenThrow(new PistonException(PistonException.Kind.TIMEOUT, "timed out"));

        ResultMessage result = process(task("python"));

        assertThat(result.status()).isEqualTo(ResultStatus.PISTON_TIMEOUT);
        verify(piston, times(1)).execute(any(), any());
    }

    @Test
    void process_engineUnreachable_connectionError() {
        when(piston.execute(any(), any()))
                .thenThrow(new PistonException(PistonException.Kind.CONNECTION, "Connection refused"));

        ResultMessage result = process(task("python"));

        assertThat(result.status()).isEqualTo(ResultStatus.PISTON_CONNECTION_ERROR);
        assertThat(result.stderr()).contains("Connection refused");
    }

    @Test
    void process_unreadableEngineResponse_responseError() {
        when(piston.execute(any(), any()))
                .thenThrow(new PistonException(PistonException.Kind.RESPONSE, "not json"));

        ResultMessage result = process(task("python"));

        assertThat(result.status()).isEqualTo(ResultStatus.PISTON_RESPONSE_ERROR);
    }

    @Test
    void process_unexpectedException_processingError() {
        when(piston.execute(any(), any())).thenThrow(new IllegalStateException("kaboom"));

        ResultMessage result = process(task("python"));

        assertThat(result.status()).isEqualTo(ResultStatus.FEEDER_PROCESSING_ERROR);
        assertThat(result.jobId()).isEqualTo("j1");
        assertThat(result.stderr()).contains("kaboom");
        assertThat(result.message()).isEqualTo("kaboom");
        assertThat(result.fail()).isTrue();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private ResultMessage process(String body) {
        return processor.process(body.getBytes(StandardCharsets.UTF_8));
    }

    private static String task(String language) {
        return "{\"job_id\":\"j1\",\"code\":\"print(1)\",\"language\":\"" + language + "\"}";
    }

    private static PistonExecuteResponse response(Stage compile, Stage run) {
        String version = compile != null ? "10.2.0" : "3.10.0";
        return new PistonExecuteResponse("python", version, compile, run);
    }

    private static Stage run(String stdout, String stderr, Integer code, String signal) {
        return new Stage(stdout, stderr, stdout + stderr, code, signal);
    }

    private static PistonException rateLimited() {
        return new PistonException(PistonException.Kind.RATE_LIMITED, 429, "rate limited", null);
    }

    private static FeederProperties props() {
        return new FeederProperties("http://engine", -1, 10000, 10000, 5, Duration.ofSeconds(10),
                10, Duration.ZERO, 1, Duration.ZERO, 1, Duration.ZERO);
    }
}
