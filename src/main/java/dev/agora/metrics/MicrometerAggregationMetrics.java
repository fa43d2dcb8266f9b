package dev.agora.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/** {@link AggregationMetrics} backed by a Micrometer {@link MeterRegistry}. */
@Component
public class MicrometerAggregationMetrics implements AggregationMetrics {

  static final String ERRORS = "agora.engine.errors";
  static final String RESULT_COUNT = "agora.engine.result.count";
  static final String SCORE = "agora.engine.score";

  private final MeterRegistry meterRegistry;

  public MicrometerAggregationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void countError(@Nullable String engine, String message, boolean secondary) {
    Counter.builder(ERRORS)
        .tag("engine", engine == null ? "" : engine)
        .tag("message", message)
        .tag("secondary", Boolean.toString(secondary))
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void observeResultCount(String engine, int count) {
    DistributionSummary.builder(RESULT_COUNT)
        .tag("engine", engine)
        .register(meterRegistry)
        .record(count);
  }

  @Override
  public void addScore(String engine, double score) {
    meterRegistry.counter(SCORE, "engine", engine).increment(score);
  }
}
