package dev.agora.search;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for querying the engines.
 *
 * <p>Properties are bound from {@code agora.search.*} in application.yml.
 *
 * <ul>
 *   <li>{@code timeout-ms} - how long a request waits for its engines (default 3000, bounded [100,
 *       60000])
 *   <li>{@code max-concurrency} - number of engines queried in parallel (default 8, bounded [1,
 *       64])
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "agora.search")
public class SearchProperties {

  private long timeoutMs = 3000;
  private int maxConcurrency = 8;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (timeoutMs < 100 || timeoutMs > 60_000) {
      throw new IllegalStateException(
          "agora.search.timeout-ms must be in [100, 60000], got: " + timeoutMs);
    }
    if (maxConcurrency < 1 || maxConcurrency > 64) {
      throw new IllegalStateException(
          "agora.search.max-concurrency must be in [1, 64], got: " + maxConcurrency);
    }
  }

  public long getTimeoutMs() {
    return timeoutMs;
  }

  public void setTimeoutMs(long timeoutMs) {
    this.timeoutMs = timeoutMs;
  }

  public int getMaxConcurrency() {
    return maxConcurrency;
  }

  public void setMaxConcurrency(int maxConcurrency) {
    this.maxConcurrency = maxConcurrency;
  }
}
