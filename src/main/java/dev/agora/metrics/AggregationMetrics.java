package dev.agora.metrics;

import org.jspecify.annotations.Nullable;

/** Telemetry sink fed by the result container. */
public interface AggregationMetrics {

  /**
   * Counts an error attributed to an engine.
   *
   * @param engine the engine, null for internally synthesized batches
   * @param message the error message
   * @param secondary true for errors that did not prevent the engine from returning results
   */
  void countError(@Nullable String engine, String message, boolean secondary);

  /** Records how many standard results an engine contributed to one request. */
  void observeResultCount(String engine, int count);

  /** Adds a merged result's score to the engine's score counter. */
  void addScore(String engine, double score);
}
