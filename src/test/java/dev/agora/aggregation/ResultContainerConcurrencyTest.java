package dev.agora.aggregation;

import static org.assertj.core.api.Assertions.assertThat;

import dev.agora.engine.EngineRegistry;
import dev.agora.fixture.LegacyResultBuilder;
import dev.agora.metrics.AggregationMetrics;
import dev.agora.result.LegacyResult;
import dev.agora.result.UrlResult;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.Test;

class ResultContainerConcurrencyTest {

  private static final int ENGINES = 16;
  private static final int RESULTS_PER_ENGINE = 30;

  private static final AggregationMetrics NO_METRICS =
      new AggregationMetrics() {
        @Override
        public void countError(@Nullable String engine, String message, boolean secondary) {}

        @Override
        public void observeResultCount(String engine, int count) {}

        @Override
        public void addScore(String engine, double score) {}
      };

  @Test
  void concurrent_batches_merge_every_contribution() throws Exception {
    ResultContainer container =
        new ResultContainer(EngineRegistry.of(), NO_METRICS, ResultFilter.ACCEPT_ALL);
    List<LegacyResult> batch = new ArrayList<>();
    for (int i = 0; i < RESULTS_PER_ENGINE; i++) {
      batch.add(LegacyResultBuilder.standard("https://x.com/" + i).build());
    }

    ExecutorService executor = Executors.newFixedThreadPool(ENGINES);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    try {
      for (int e = 0; e < ENGINES; e++) {
        String engine = "engine-" + e;
        futures.add(
            executor.submit(
                () -> {
                  start.await();
                  container.extend(engine, batch);
                  return null;
                }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(10, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    List<UrlResult> ordered = container.getOrderedResults();

    assertThat(ordered).hasSize(RESULTS_PER_ENGINE);
    for (UrlResult result : ordered) {
      assertThat(result.getEngines()).hasSize(ENGINES);
      assertThat(result.getPositions()).hasSize(ENGINES);
      int rank = Integer.parseInt(result.getUrl().substring("https://x.com/".length())) + 1;
      assertThat(result.getPositions()).containsOnly(rank);
    }
  }

  @Test
  void close_racing_with_extend_never_loses_consistency() throws Exception {
    ResultContainer container =
        new ResultContainer(EngineRegistry.of(), NO_METRICS, ResultFilter.ACCEPT_ALL);
    ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int e = 0; e < 4; e++) {
        String engine = "engine-" + e;
        futures.add(
            executor.submit(
                () -> {
                  for (int i = 0; i < 50; i++) {
                    LegacyResult result =
                        LegacyResultBuilder.standard("https://x.com/" + i).build();
                    container.extend(engine, List.of(result));
                  }
                }));
      }
      container.close();
      for (Future<?> future : futures) {
        future.get(10, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    List<UrlResult> ordered = container.getOrderedResults();
    assertThat(container.isClosed()).isTrue();
    assertThat(container.getOrderedResults()).isSameAs(ordered);
    for (UrlResult result : ordered) {
      assertThat(result.getPositions()).hasSameSizeAs(result.getEngines());
    }
  }

  @Test
  void readers_racing_with_close_all_see_the_final_order() throws Exception {
    ResultContainer container =
        new ResultContainer(EngineRegistry.of(), NO_METRICS, ResultFilter.ACCEPT_ALL);
    List<LegacyResult> batch = new ArrayList<>();
    for (int i = 0; i < RESULTS_PER_ENGINE; i++) {
      batch.add(LegacyResultBuilder.standard("https://x.com/" + i).build());
    }
    container.extend("engine", batch);

    ExecutorService executor = Executors.newFixedThreadPool(ENGINES);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<List<UrlResult>>> readers = new ArrayList<>();
    try {
      for (int r = 0; r < ENGINES; r++) {
        readers.add(
            executor.submit(
                () -> {
                  start.await();
                  return container.getOrderedResults();
                }));
      }
      start.countDown();
      container.close();
      for (Future<List<UrlResult>> reader : readers) {
        assertThat(reader.get(10, TimeUnit.SECONDS))
            .hasSize(RESULTS_PER_ENGINE)
            .isSameAs(container.getOrderedResults());
      }
    } finally {
      executor.shutdownNow();
    }
  }
}
