package dev.agora.search;

import dev.agora.aggregation.ResultContainer;
import dev.agora.aggregation.ResultContainerFactory;
import dev.agora.aggregation.UnsupportedResultTypeException;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Queries all engines of a request in parallel and feeds their results into one {@link
 * ResultContainer}.
 *
 * <p>Pipeline: create container -> submit one task per engine -> each task runs the engine, calls
 * {@link ResultContainer#extend} and records its timing -> wait for all tasks until the request
 * deadline -> report engines that failed or missed the deadline as unresponsive -> close the
 * container.
 */
@Service
public class SearchCoordinator {

  private static final Logger log = LoggerFactory.getLogger(SearchCoordinator.class);

  static final String TIMEOUT = "timeout";
  static final String UNEXPECTED_CRASH = "unexpected crash";

  private final ResultContainerFactory containerFactory;
  private final Clock clock;
  private final long timeoutMs;
  private final ExecutorService executor;

  public SearchCoordinator(
      ResultContainerFactory containerFactory, SearchProperties properties, Clock clock) {
    this.containerFactory = containerFactory;
    this.clock = clock;
    this.timeoutMs = properties.getTimeoutMs();
    this.executor = Executors.newFixedThreadPool(properties.getMaxConcurrency());
  }

  /**
   * Runs the query against every engine and returns the closed container.
   *
   * @param query the user's query
   * @param backends the engines to query
   * @return the closed container holding the merged results
   * @throws UnsupportedResultTypeException if an engine produced a result type without handler
   */
  public ResultContainer search(String query, List<? extends SearchBackend> backends) {
    ResultContainer container = containerFactory.create();
    long deadline = clock.millis() + timeoutMs;

    Map<SearchBackend, Future<?>> tasks = new LinkedHashMap<>();
    for (SearchBackend backend : backends) {
      tasks.put(backend, executor.submit(() -> runBackend(backend, query, container)));
    }

    try {
      for (Map.Entry<SearchBackend, Future<?>> task : tasks.entrySet()) {
        awaitBackend(task.getKey(), task.getValue(), deadline, container);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for engines, closing with partial results");
    } finally {
      tasks.values().forEach(future -> future.cancel(true));
    }

    container.close();
    log.debug(
        "Search '{}' done: {} results from {} engines",
        query,
        container.resultsLength(),
        backends.size());
    return container;
  }

  private void awaitBackend(
      SearchBackend backend, Future<?> future, long deadline, ResultContainer container)
      throws InterruptedException {
    long remaining = Math.max(0, deadline - clock.millis());
    try {
      future.get(remaining, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      log.warn("Engine {} timed out after {} ms", backend.name(), timeoutMs);
      container.addUnresponsiveEngine(backend.name(), TIMEOUT, false);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new IllegalStateException("Engine " + backend.name() + " failed", e.getCause());
    }
  }

  private void runBackend(SearchBackend backend, String query, ResultContainer container) {
    long start = clock.millis();
    try {
      BackendResponse response = backend.search(query);
      container.extend(backend.name(), response.results());
      container.addTiming(
          backend.name(), Duration.ofMillis(clock.millis() - start), response.loadTime());
    } catch (BackendException e) {
      log.warn("Engine {} failed ({}): {}", backend.name(), e.getErrorType(), e.getMessage());
      container.addUnresponsiveEngine(backend.name(), e.getErrorType(), e.isSuspended());
    } catch (UnsupportedResultTypeException e) {
      throw e;
    } catch (RuntimeException e) {
      log.warn("Engine {} crashed: {}", backend.name(), e.getMessage(), e);
      container.addUnresponsiveEngine(backend.name(), UNEXPECTED_CRASH, false);
    }
  }

  @PreDestroy
  void shutdown() {
    executor.shutdownNow();
  }
}
