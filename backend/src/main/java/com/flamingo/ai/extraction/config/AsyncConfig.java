package com.flamingo.ai.extraction.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Executors for agent calls. */
@Configuration
@Slf4j
public class AsyncConfig {

  /**
   * Extraction agent pool. Sized to the configured pool size, never below the largest agent
   * count, so that every assignment of a document runs at once. Extra documents queue; an agent's
   * timeout starts when it runs.
   */
  @Bean(name = "extractionAgentExecutor")
  public ThreadPoolTaskExecutor extractionAgentExecutor(ExtractionConfig config) {
    int largest =
        Math.max(
            config.getScaling().getLargeAgentCount(),
            Math.max(
                config.getScaling().getMediumAgentCount(),
                config.getScaling().getSmallAgentCount()));
    int poolSize = Math.max(config.getAgents().getPoolSize(), largest);
    if (poolSize != config.getAgents().getPoolSize()) {
      log.warn(
          "extraction.agents.pool-size {} is below the largest agent count {}, using {}",
          config.getAgents().getPoolSize(),
          largest,
          poolSize);
    }

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(poolSize);
    executor.setMaxPoolSize(poolSize);
    executor.setQueueCapacity(500);
    executor.setThreadNamePrefix("extract-agent-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }

  /**
   * Discovery passes run one at a time per document, so the pool size bounds how many documents
   * are discovered at once. Extra passes queue; their timeout starts when they run.
   */
  @Bean(name = "discoveryExecutor")
  public ThreadPoolTaskExecutor discoveryExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("discovery-");
    executor.initialize();
    return executor;
  }
}
