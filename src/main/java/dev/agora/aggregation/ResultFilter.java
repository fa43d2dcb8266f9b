package dev.agora.aggregation;

import dev.agora.result.Result;

/**
 * Veto hook called once for every candidate answer, suggestion, correction and search result
 * before the container accepts it. Implementations may have side effects (e.g. rewriting links);
 * the container only honours the verdict.
 */
@FunctionalInterface
public interface ResultFilter {

  /** Accepts every result. */
  ResultFilter ACCEPT_ALL = result -> true;

  /**
   * @param result the candidate
   * @return true to accept the result, false to drop it
   */
  boolean accept(Result result);
}
