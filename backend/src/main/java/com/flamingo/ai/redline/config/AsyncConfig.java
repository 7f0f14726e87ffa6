package com.flamingo.ai.redline.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for work that runs off the request thread. */
@Configuration
public class AsyncConfig {

  /** Single-threaded executor that tears down parsed document graphs after their request ends. */
  @Bean(name = "documentCleanupExecutor")
  public Executor documentCleanupExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(1);
    executor.setQueueCapacity(256);
    executor.setThreadNamePrefix("doc-cleanup-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }
}
