package com.flamingo.ai.voicecompanion.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for async operations. */
@Configuration
@EnableAsync
public class AsyncConfig {

  /** Runs retrieval for finalized utterances off the recognizers' delivery threads. */
  @Bean(name = "retrievalExecutor")
  public Executor retrievalExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(8);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("retrieval-");
    executor.initialize();
    return executor;
  }
}
