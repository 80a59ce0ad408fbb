package com.codeflag.scheduler.config;

import com.codeflag.common.broker.BrokerConnector;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Broker topology and connection policy.
 *
 * Both queues are declared durable here as well as in the feeder, so
 * whichever process starts first creates them. Declaration is idempotent.
 */
@Configuration
public class BrokerConfig {

    private static final Duration MAX_CONNECT_DELAY = Duration.ofSeconds(60);

    @Bean
    Queue taskQueue(QueueProperties queues) {
        return QueueBuilder.durable(queues.tasks()).build();
    }

    @Bean
    Queue resultQueue(QueueProperties queues) {
        return QueueBuilder.durable(queues.results()).build();
    }

    @Bean
    BrokerConnector brokerConnector(ConnectionFactory connectionFactory, SchedulerProperties props) {
        return new BrokerConnector(connectionFactory,
                props.brokerConnectAttempts(), props.brokerBackoff(), MAX_CONNECT_DELAY);
    }
}
