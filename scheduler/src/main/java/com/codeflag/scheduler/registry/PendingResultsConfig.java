package com.codeflag.scheduler.registry;

import com.codeflag.common.message.ResultMessage;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * The pending-result registry lives as long as the application context:
 * created at startup, and every outstanding waiter released on shutdown.
 */
@Configuration
public class PendingResultsConfig {

    @Bean(destroyMethod = "cancelAll")
    CompletionRegistry<String, ResultMessage> pendingResults() {
        return new CompletionRegistry<>();
    }
}
