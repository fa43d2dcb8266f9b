package dev.agora.search;

import dev.agora.result.RawResult;
import java.time.Duration;
import java.util.List;

/**
 * What an engine returned for one query.
 *
 * @param results the results in the engine's rank order
 * @param loadTime time spent loading the engine's response
 */
public record BackendResponse(List<? extends RawResult> results, Duration loadTime) {

  public BackendResponse {
    results = results == null ? List.of() : List.copyOf(results);
    loadTime = loadTime == null ? Duration.ZERO : loadTime;
  }
}
