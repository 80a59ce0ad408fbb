package com.codeflag.feeder.task;

import com.codeflag.common.message.ResultMessage;
import com.rabbitmq.client.Channel;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Consumes the task queue with manual acknowledgement.
 *
 * A task is acknowledged only after its result has been published. If the
 * broker rejects the publish the task is returned to the queue, so a result
 * is never lost between the two. Any other publish failure is not transient,
 * so the task is rejected without requeue instead of holding the consumer's
 * only prefetch slot.
 */
@Component
public class TaskListener {

    public static final String ID = "taskListener";

    private static final Logger log = LoggerFactory.getLogger(TaskListener.class);

    private final TaskProcessor   processor;
    private final ResultPublisher resultPublisher;
    private final MeterRegistry   meterRegistry;

    public TaskListener(TaskProcessor processor, ResultPublisher resultPublisher, MeterRegistry meterRegistry) {
        this.processor       = processor;
        this.resultPublisher = resultPublisher;
        this.meterRegistry   = meterRegistry;
    }

    @RabbitListener(id = ID, queues = "${codeflag.queues.tasks}", containerFactory = "taskListenerFactory")
    public void onTask(Message message, Channel channel) throws IOException {
        long deliveryTag = message.getMessageProperties().getDeliveryTag();
        ResultMessage result = processor.process(message.getBody());

        try {
            resultPublisher.publish(result);
        } catch (AmqpException e) {
            log.error("Failed to publish result for job ID {}; returning task to the queue", result.jobId(), e);
            channel.basicNack(deliveryTag, false, true);
            return;
        } catch (RuntimeException e) {
            // would fail the same way on every redelivery
            log.error("Could not publish result for job ID {}; discarding task", result.jobId(), e);
            channel.basicNack(deliveryTag, false, false);
            meterRegistry.counter("codeflag.feeder.discarded").increment();
            return;
        }
        channel.basicAck(deliveryTag, false);

        meterRegistry.counter("codeflag.feeder.results", "status", result.status()).increment();
        log.info("Published result for job ID {} (status={})", result.jobId(), result.status());
    }
}
