package com.codeflag.scheduler.broker;

import com.codeflag.common.broker.BrokerConnector;
import com.rabbitmq.client.ShutdownSignalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.rabbit.connection.AbstractConnectionFactory;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.connection.ConnectionListener;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Tracks whether the broker connection is usable for publishing.
 *
 * State follows the connection factory's lifecycle events, so it flips back
 * to available on its own when the result listener container (or any other
 * user of the factory) re-establishes the connection.
 *
 * At startup the connection is opened in the background with capped
 * exponential backoff. If that gives up, the application keeps running:
 * submissions are answered with 503 while the result listener keeps
 * recovering and can still drain jobs already published.
 */
@Component
public class BrokerMonitor implements ConnectionListener {

    private static final Logger log = LoggerFactory.getLogger(BrokerMonitor.class);

    private final AtomicBoolean   available = new AtomicBoolean(false);
    private final BrokerConnector connector;

    public BrokerMonitor(AbstractConnectionFactory connectionFactory, BrokerConnector connector) {
        this.connector = connector;
        connectionFactory.addConnectionListener(this);
    }

    public boolean isAvailable() {
        return available.get();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void connectInBackground() {
        Thread thread = new Thread(() -> {
            if (!connector.connect()) {
                log.error("RabbitMQ publisher connection could not be established. "
                        + "Submissions will be rejected until the broker is reachable.");
            }
        }, "broker-connect");
        thread.setDaemon(true);
        thread.start();
    }

    @Override
    public void onCreate(Connection connection) {
        if (!available.getAndSet(true)) {
            log.info("RabbitMQ connection established; accepting submissions");
        }
    }

    @Override
    public void onClose(Connection connection) {
        markUnavailable("connection closed");
    }

    @Override
    public void onShutDown(ShutdownSignalException signal) {
        markUnavailable(signal.getMessage());
    }

    @Override
    public void onFailed(Exception exception) {
        markUnavailable(exception.getMessage());
    }

    private void markUnavailable(String reason) {
        if (available.getAndSet(false)) {
            log.warn("RabbitMQ connection lost ({}); rejecting submissions until it recovers", reason);
        }
    }
}
