package com.flamingo.ai.chainsearch.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the chain embedding pipeline and message search. */
@Configuration
@ConfigurationProperties(prefix = "chain-search")
@Getter
@Setter
public class ChainSearchConfig {

  private Chain chain = new Chain();
  private Processing processing = new Processing();
  private Context context = new Context();
  private Search search = new Search();
  private Embedding embedding = new Embedding();
  private Formatting formatting = new Formatting();

  @Getter
  @Setter
  public static class Chain {
    /** Largest gap between two consecutive messages that still keeps them in one chain. */
    private Duration maxIdleGap = Duration.ofHours(1);

    /** How many of the author's most recent messages are inspected when walking a chain. */
    private int lookback = 100;
  }

  /**
   * Settings of the durable debounce queue. A burst of messages from one author in one channel or
   * conversation re-arms a single task, so only one LLM and embedding call is made per burst.
   */
  @Getter
  @Setter
  public static class Processing {
    private Duration delay = Duration.ofSeconds(48);

    /** Poller period, read by the scheduler as {@code poll-interval-ms}. */
    private long pollIntervalMs = 5000;

    /** Delay before the first poll after startup. */
    private long initialDelayMs = 10000;

    private int batchSize = 20;
    private int maxAttempts = 5;
    private Duration retryBackoff = Duration.ofMinutes(1);
  }

  @Getter
  @Setter
  public static class Context {
    private boolean enabled = true;

    /** Only the most recent part of the transcript is sent to the model. */
    private int maxTranscriptChars = 12_000;

    private double temperature = 0.3;
    private int maxTokens = 100;
  }

  @Getter
  @Setter
  public static class Search {
    private double similarityThreshold = 0.3;
    private int maxResults = 10;
    private boolean includeChain = true;
  }

  @Getter
  @Setter
  public static class Embedding {
    private String documentPrefix = "Represent this chat excerpt for retrieval: ";
    private String queryPrefix = "Represent this question for retrieving relevant chat messages: ";
    private int maxChars = 5000;
  }

  @Getter
  @Setter
  public static class Formatting {
    /** Zone used for date headers and message times in transcripts. */
    private String zone = "UTC";
  }
}
