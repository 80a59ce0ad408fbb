package com.codeflag.feeder;

import com.codeflag.common.broker.BrokerConnector;
import com.codeflag.feeder.config.QueueProperties;
import com.codeflag.feeder.task.TaskListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.rabbit.listener.MessageListenerContainer;
import org.springframework.amqp.rabbit.listener.RabbitListenerEndpointRegistry;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Connects to the broker and only then starts consuming tasks.
 *
 * The runtime registry is already loaded by the time this runs (it is a
 * bean the task listener depends on). A broker that stays unreachable
 * fails startup, and the process exits non-zero.
 */
@Component
public class FeederStartup implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(FeederStartup.class);

    private final BrokerConnector                connector;
    private final RabbitListenerEndpointRegistry listeners;
    private final QueueProperties                queues;

    public FeederStartup(BrokerConnector connector,
                         RabbitListenerEndpointRegistry listeners,
                         QueueProperties queues) {
        this.connector = connector;
        this.listeners = listeners;
        this.queues    = queues;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!connector.connect()) {
            throw new IllegalStateException("Could not connect to RabbitMQ; feeder cannot start");
        }
        MessageListenerContainer container = listeners.getListenerContainer(TaskListener.ID);
        if (container == null) {
            throw new IllegalStateException("Task listener container '" + TaskListener.ID + "' is not registered");
        }
        container.start();
        log.info("Waiting for messages on queue: {}", queues.tasks());
    }
}
