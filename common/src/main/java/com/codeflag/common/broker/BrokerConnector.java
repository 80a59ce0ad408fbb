package com.codeflag.common.broker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;

import java.time.Duration;

/**
 * Establishes the broker connection with capped exponential backoff.
 *
 * Attempt n (0-based) waits {@code baseDelay * 2^(n-1)} before trying, never
 * more than {@code maxDelay}. The first attempt is immediate. What to do
 * when every attempt fails is the caller's decision: the feeder exits, the
 * scheduler keeps serving and rejects submissions.
 */
public class BrokerConnector {

    private static final Logger log = LoggerFactory.getLogger(BrokerConnector.class);

    private final ConnectionFactory connectionFactory;
    private final int      maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;

    public BrokerConnector(ConnectionFactory connectionFactory,
                           int maxAttempts,
                           Duration baseDelay,
                           Duration maxDelay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.connectionFactory = connectionFactory;
        this.maxAttempts       = maxAttempts;
        this.baseDelay         = baseDelay;
        this.maxDelay          = maxDelay;
    }

    /** @return true once a connection is open, false when all attempts failed or the thread was interrupted */
    public boolean connect() {
        String target = connectionFactory.getHost() + ":" + connectionFactory.getPort();
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            if (attempt > 0 && !sleep(delayBefore(attempt))) {
                return false;
            }
            try {
                Connection connection = connectionFactory.createConnection();
                if (connection.isOpen()) {
                    log.info("Connected to RabbitMQ at {}", target);
                    return true;
                }
            } catch (AmqpException e) {
                log.error("Attempt {}/{}: failed to connect to RabbitMQ at {} - {}",
                        attempt + 1, maxAttempts, target, e.getMessage());
            }
        }
        log.error("Failed to connect to RabbitMQ at {} after {} attempts", target, maxAttempts);
        return false;
    }

    Duration delayBefore(int attempt) {
        Duration delay = baseDelay.multipliedBy(1L << Math.min(attempt - 1, 20));
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }

    private static boolean sleep(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
