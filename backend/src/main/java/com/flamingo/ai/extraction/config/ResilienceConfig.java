package com.flamingo.ai.extraction.config;

import com.flamingo.ai.extraction.exception.DiscoveryTimeoutException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Resilience4j policies for agent calls. */
@Configuration
@Slf4j
public class ResilienceConfig {

  public static final String DISCOVERY_RETRY = "discovery";

  /** Retries a discovery pass only when it timed out; every other failure propagates at once. */
  @Bean
  public Retry discoveryRetry(RetryRegistry retryRegistry, ExtractionConfig config) {
    RetryConfig retryConfig =
        RetryConfig.custom()
            .maxAttempts(Math.max(1, config.getDiscovery().getMaxAttempts()))
            .waitDuration(config.getDiscovery().getRetryWait())
            .retryExceptions(DiscoveryTimeoutException.class)
            .build();
    Retry retry = retryRegistry.retry(DISCOVERY_RETRY, retryConfig);
    retry
        .getEventPublisher()
        .onRetry(
            event ->
                log.warn(
                    "Retrying discovery pass (attempt {}): {}",
                    event.getNumberOfRetryAttempts(),
                    event.getLastThrowable() != null
                        ? event.getLastThrowable().getMessage()
                        : "timeout"));
    return retry;
  }
}
