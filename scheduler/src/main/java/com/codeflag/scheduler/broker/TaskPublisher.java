package com.codeflag.scheduler.broker;

import com.codeflag.common.message.TaskMessage;
import com.codeflag.scheduler.config.QueueProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageBuilder;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes tasks to the task queue through the default exchange.
 * Messages are persistent so a broker restart does not lose queued work.
 */
@Component
public class TaskPublisher {

    private static final Logger log = LoggerFactory.getLogger(TaskPublisher.class);

    private final RabbitTemplate  rabbit;
    private final ObjectMapper    json;
    private final QueueProperties queues;

    public TaskPublisher(RabbitTemplate rabbit, ObjectMapper objectMapper, QueueProperties queues) {
        this.rabbit = rabbit;
        this.json   = objectMapper;
        this.queues = queues;
    }

    /**
     * @throws AmqpException if the broker rejects or cannot take the message
     */
    public void publish(TaskMessage task) {
        byte[] body;
        try {
            body = json.writeValueAsBytes(task);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize task " + task.jobId(), e);
        }
        Message message = MessageBuilder.withBody(body)
                .setContentType(MessageProperties.CONTENT_TYPE_JSON)
                .setContentEncoding("UTF-8")
                .setDeliveryMode(MessageDeliveryMode.PERSISTENT)
                .setMessageId(task.jobId())
                .build();
        rabbit.send("", queues.tasks(), message);
        log.info("Published task for job ID: {} to {}", task.jobId(), queues.tasks());
    }
}
