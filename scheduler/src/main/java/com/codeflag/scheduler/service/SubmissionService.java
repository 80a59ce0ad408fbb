package com.codeflag.scheduler.service;

import com.codeflag.common.message.ResultMessage;
import com.codeflag.common.message.TaskMessage;
import com.codeflag.scheduler.broker.BrokerMonitor;
import com.codeflag.scheduler.broker.TaskPublisher;
import com.codeflag.scheduler.config.SchedulerProperties;
import com.codeflag.scheduler.crypto.CryptoKeys;
import com.codeflag.scheduler.crypto.ExecutionOverrides;
import com.codeflag.scheduler.crypto.SettingsException;
import com.codeflag.scheduler.registry.CompletionRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.amqp.AmqpException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Turns one blocking submission into a published task and waits for its result.
 *
 * Steps:
 *  1. Refuse early if keys are missing (500) or the broker is down (503)
 *  2. Decrypt the optional settings into overrides (400 on a bad token)
 *  3. Register a pending handle under a fresh job ID, then publish the task
 *  4. Block on the handle until the result arrives or the deadline passes (504)
 *  5. Sign the result's stdout and return the flag
 *
 * Every handle registered in step 3 is removed again: by the result listener
 * when the result arrives, or here on timeout, publish failure or interrupt.
 */
@Service
public class SubmissionService {

    private static final Logger log = LoggerFactory.getLogger(SubmissionService.class);

    private final CryptoKeys    cryptoKeys;
    private final BrokerMonitor brokerMonitor;
    private final TaskPublisher taskPublisher;
    private final CompletionRegistry<String, ResultMessage> pendingResults;
    private final MeterRegistry meterRegistry;
    private final Duration      executionTimeout;

    public SubmissionService(CryptoKeys cryptoKeys,
                             BrokerMonitor brokerMonitor,
                             TaskPublisher taskPublisher,
                             CompletionRegistry<String, ResultMessage> pendingResults,
                             MeterRegistry meterRegistry,
                             SchedulerProperties props) {
        this.cryptoKeys       = cryptoKeys;
        this.brokerMonitor    = brokerMonitor;
        this.taskPublisher    = taskPublisher;
        this.pendingResults   = pendingResults;
        this.meterRegistry    = meterRegistry;
        this.executionTimeout = props.executionTimeout();
    }

    /**
     * @param settings encrypted settings token, or null
     * @return the flag for the program's stdout
     * @throws SubmissionException for every outcome other than a flag
     */
    public String submit(String code, String language, String settings) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "ok";
        try {
            return run(code, language, settings);
        } catch (SubmissionException e) {
            outcome = e.getKind().name().toLowerCase();
            throw e;
        } catch (RuntimeException e) {
            outcome = "error";
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("codeflag.submission.duration"));
            meterRegistry.counter("codeflag.submissions", "outcome", outcome).increment();
        }
    }

    private String run(String code, String language, String settings) {
        if (!cryptoKeys.isConfigured()) {
            throw new SubmissionException(SubmissionException.Kind.UNCONFIGURED,
                    "Server is not configured with necessary security keys.");
        }
        if (!brokerMonitor.isAvailable()) {
            throw new SubmissionException(SubmissionException.Kind.BROKER_UNAVAILABLE,
                    "Scheduler is not connected to RabbitMQ for publishing.");
        }

        ExecutionOverrides overrides = decodeSettings(settings);

        String jobId = UUID.randomUUID().toString();
        MDC.put("jobId", jobId);
        MDC.put("language", language);
        try {
            log.info("Received request for job ID: {}", jobId);
            ResultMessage result = publishAndAwait(new TaskMessage(jobId, code, language,
                    overrides.memoryLimit(), overrides.compileTimeout(), overrides.runTimeout()));
            log.info("Received result from feeder for job ID: {} (status={})", jobId, result.status());
            return cryptoKeys.flagSigner().sign(result.stdout());
        } finally {
            MDC.remove("jobId");
            MDC.remove("language");
        }
    }

    private ExecutionOverrides decodeSettings(String settings) {
        if (settings == null) {
            return ExecutionOverrides.none();
        }
        try {
            return cryptoKeys.settingsDecoder().decode(settings);
        } catch (SettingsException e) {
            log.warn("Failed to process settings: {} ({})", e.getMessage(), e.getKind());
            throw new SubmissionException(SubmissionException.Kind.INVALID_SETTINGS,
                    "Invalid or unprocessable settings: " + e.getMessage(), e);
        }
    }

    private ResultMessage publishAndAwait(TaskMessage task) {
        String jobId = task.jobId();
        CompletableFuture<ResultMessage> handle = pendingResults.register(jobId);

        try {
            taskPublisher.publish(task);
        } catch (AmqpException e) {
            pendingResults.cancel(jobId);
            log.error("Failed to publish task for job ID {}: {}", jobId, e.getMessage());
            throw new SubmissionException(SubmissionException.Kind.BROKER_UNAVAILABLE,
                    "Scheduler could not publish the task to RabbitMQ.", e);
        } catch (RuntimeException e) {
            pendingResults.cancel(jobId);
            throw e;
        }

        try {
            return handle.get(executionTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            if (!pendingResults.cancel(jobId) && handle.isDone() && !handle.isCompletedExceptionally()) {
                // resolved between the deadline and the cancel
                return handle.join();
            }
            log.warn("Execution timed out for job ID: {}", jobId);
            throw new SubmissionException(SubmissionException.Kind.TIMEOUT,
                    "Code execution timed out after " + executionTimeout.toSeconds() + " seconds.");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pendingResults.cancel(jobId);
            throw new SubmissionException(SubmissionException.Kind.INTERNAL,
                    "Interrupted while waiting for the execution result.", e);
        } catch (ExecutionException | CancellationException e) {
            pendingResults.cancel(jobId);
            log.error("An error occurred while waiting for result for job ID {}", jobId, e);
            throw new SubmissionException(SubmissionException.Kind.INTERNAL,
                    "An error occurred while waiting for the execution result.", e);
        }
    }
}
