package com.codeflag.feeder.task;

import com.codeflag.common.message.ResultMessage;
import com.codeflag.feeder.config.QueueProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageBuilder;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Component;

/** Publishes results to the results queue as persistent messages. */
@Component
public class ResultPublisher {

    private final RabbitTemplate  rabbit;
    private final ObjectMapper    json;
    private final QueueProperties queues;

    public ResultPublisher(RabbitTemplate rabbit, ObjectMapper objectMapper, QueueProperties queues) {
        this.rabbit = rabbit;
        this.json   = objectMapper;
        this.queues = queues;
    }

    /**
     * @throws AmqpException if the broker cannot take the message
     */
    public void publish(ResultMessage result) {
        byte[] body;
        try {
            body = json.writeValueAsBytes(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize result for job " + result.jobId(), e);
        }
        Message message = MessageBuilder.withBody(body)
                .setContentType(MessageProperties.CONTENT_TYPE_JSON)
                .setContentEncoding("UTF-8")
                .setDeliveryMode(MessageDeliveryMode.PERSISTENT)
                .setMessageId(result.jobId())
                .build();
        rabbit.send("", queues.results(), message);
    }
}
