package com.codeflag.feeder.config;

import com.codeflag.common.broker.BrokerConnector;
import com.codeflag.feeder.piston.PistonClient;
import com.codeflag.feeder.runtime.RuntimeLoader;
import com.codeflag.feeder.runtime.RuntimeRegistry;
import org.springframework.amqp.core.AcknowledgeMode;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.rabbit.config.SimpleRabbitListenerContainerFactory;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.boot.autoconfigure.amqp.SimpleRabbitListenerContainerFactoryConfigurer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Broker topology, the task consumer pool and the runtime registry.
 *
 * The task listener is built with auto-startup off; {@link com.codeflag.feeder.FeederStartup}
 * starts it once the broker connection is up. Each of the {@code prefetch}
 * consumers holds at most one unacknowledged task, so no more than
 * {@code prefetch} engine calls are in flight.
 */
@Configuration
public class FeederConfig {

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
    SimpleRabbitListenerContainerFactory taskListenerFactory(
            SimpleRabbitListenerContainerFactoryConfigurer configurer,
            ConnectionFactory connectionFactory,
            FeederProperties props) {
        SimpleRabbitListenerContainerFactory factory = new SimpleRabbitListenerContainerFactory();
        configurer.configure(factory, connectionFactory);
        factory.setAcknowledgeMode(AcknowledgeMode.MANUAL);
        factory.setConcurrentConsumers(props.prefetch());
        factory.setMaxConcurrentConsumers(props.prefetch());
        factory.setPrefetchCount(1);
        factory.setAutoStartup(false);
        return factory;
    }

    @Bean
    BrokerConnector brokerConnector(ConnectionFactory connectionFactory, FeederProperties props) {
        return new BrokerConnector(connectionFactory,
                props.brokerConnectAttempts(), props.brokerBackoff(), MAX_CONNECT_DELAY);
    }

    /** Loaded during context refresh; a failure here aborts startup. */
    @Bean
    RuntimeRegistry runtimeRegistry(PistonClient pistonClient, FeederProperties props) {
        return new RuntimeLoader(pistonClient, props.runtimeFetchAttempts(), props.runtimeFetchBackoff())
                .load();
    }
}
