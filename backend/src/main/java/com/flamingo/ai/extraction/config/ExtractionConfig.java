package com.flamingo.ai.extraction.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the extraction engine. */
@Configuration
@ConfigurationProperties(prefix = "extraction")
@Getter
@Setter
public class ExtractionConfig {

  private Discovery discovery = new Discovery();
  private Scaling scaling = new Scaling();
  private Agents agents = new Agents();
  private Consolidation consolidation = new Consolidation();
  private Documents documents = new Documents();

  @Getter
  @Setter
  public static class Discovery {
    /** Documents with at most this many pages use a single discovery agent. */
    private int singleAgentMaxPages = 50;

    private int singleAgentSamplePages = 8;

    /** Number of sequential agents for long documents. */
    private int chainAgentCount = 3;

    private int chainSamplePages = 15;

    /** Fewer discovered fields than this fails discovery with low confidence. */
    private int minFieldCount = 1;

    private Duration agentTimeout = Duration.ofSeconds(60);

    /** Total attempts per discovery pass when the agent times out (2 = one retry). */
    private int maxAttempts = 2;

    private Duration retryWait = Duration.ofMillis(500);

    /** Characters of each sampled page passed to the model. */
    private int maxPageChars = 3000;
  }

  @Getter
  @Setter
  public static class Scaling {
    /** Documents below this page count get {@link #smallAgentCount} agents. */
    private int smallDocumentPages = 20;

    /** Documents above this page count get {@link #largeAgentCount} agents. */
    private int largeDocumentPages = 100;

    private int smallAgentCount = 2;
    private int mediumAgentCount = 5;
    private int largeAgentCount = 10;
  }

  @Getter
  @Setter
  public static class Agents {
    /** Independent timeout of each extraction agent. */
    private Duration timeout = Duration.ofSeconds(120);

    /** Deadline for a whole document; in-flight agents are cancelled when it passes. */
    private Duration documentDeadline = Duration.ofMinutes(10);

    /** Worker threads; must be at least the largest agent count. */
    private int poolSize = 10;

    /** Characters of each assigned page passed to the model. */
    private int maxPageChars = 6000;

    /** Upper bound for the confidence of values not found verbatim in the page text. */
    private double inferredConfidenceCap = 0.8;
  }

  @Getter
  @Setter
  public static class Consolidation {
    /** Fields resolved below this confidence are flagged for review. */
    private double lowConfidenceThreshold = 0.5;

    /** Records with a smaller fraction of completed agents are marked degraded. */
    private double minCompletedFraction = 0.5;
  }

  @Getter
  @Setter
  public static class Documents {
    /** Directory holding uploaded PDFs, one file per document id. */
    private String basePath = "data/documents";

    private long maxFileSizeBytes = 50 * 1024 * 1024L; // 50 MB
  }
}
