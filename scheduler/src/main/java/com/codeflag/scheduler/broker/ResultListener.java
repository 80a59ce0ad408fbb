package com.codeflag.scheduler.broker;

import com.codeflag.common.message.ResultMessage;
import com.codeflag.scheduler.registry.CompletionRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Consumes the results queue for the lifetime of the process and hands each
 * result to whichever submission is waiting for its job_id.
 *
 * This method never throws: every message is acknowledged, including
 * malformed ones and results nobody is waiting for (the waiter timed out, or
 * the job belongs to another scheduler instance). Requeueing those would
 * only loop them forever.
 */
@Component
public class ResultListener {

    private static final Logger log = LoggerFactory.getLogger(ResultListener.class);

    private final CompletionRegistry<String, ResultMessage> pendingResults;
    private final ObjectMapper json;

    public ResultListener(CompletionRegistry<String, ResultMessage> pendingResults,
                          ObjectMapper objectMapper) {
        this.pendingResults = pendingResults;
        this.json           = objectMapper;
    }

    @RabbitListener(queues = "${codeflag.queues.results}")
    public void onResult(Message message) {
        ResultMessage result;
        try {
            result = json.readValue(message.getBody(), ResultMessage.class);
        } catch (IOException e) {
            log.error("Failed to decode JSON message from results queue: {}",
                    new String(message.getBody(), StandardCharsets.UTF_8), e);
            return;
        }

        if (result == null || result.jobId() == null) {
            log.warn("Received result without job ID (status={}). Skipping.",
                    result == null ? null : result.status());
            return;
        }
        if (pendingResults.resolve(result.jobId(), result)) {
            log.info("Received result for job ID: {} (status={})", result.jobId(), result.status());
        } else {
            log.warn("Received result for unknown or expired job ID: {}. Skipping.", result.jobId());
        }
    }
}
