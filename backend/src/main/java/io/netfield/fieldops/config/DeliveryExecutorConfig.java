package io.netfield.fieldops.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded pools for envelope delivery. A full queue rejects the task and the envelope stays
 * PENDING for the dispatch loop.
 */
@Configuration
public class DeliveryExecutorConfig {

  /** Runs transport sends so that a hung provider call can be timed out by the caller. */
  @Bean(name = "transportExecutor")
  public ThreadPoolTaskExecutor transportExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("transport-send-");
    executor.setDaemon(true);
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(10);
    executor.initialize();
    return executor;
  }

  /** Runs after-commit inline delivery off the producer's thread. */
  @Bean(name = "inlineDeliveryExecutor")
  public ThreadPoolTaskExecutor inlineDeliveryExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(1);
    executor.setQueueCapacity(500);
    executor.setThreadNamePrefix("envelope-inline-");
    executor.setDaemon(true);
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(10);
    executor.initialize();
    return executor;
  }
}
