package dev.agora.aggregation;

import dev.agora.engine.EngineRegistry;
import dev.agora.metrics.AggregationMetrics;
import org.springframework.stereotype.Component;

/** Creates one {@link ResultContainer} per search request, wired to the shared collaborators. */
@Component
public class ResultContainerFactory {

  private final EngineRegistry engineRegistry;
  private final AggregationMetrics metrics;
  private final ResultFilter resultFilter;

  public ResultContainerFactory(
      EngineRegistry engineRegistry, AggregationMetrics metrics, ResultFilter resultFilter) {
    this.engineRegistry = engineRegistry;
    this.metrics = metrics;
    this.resultFilter = resultFilter;
  }

  public ResultContainer create() {
    return new ResultContainer(engineRegistry, metrics, resultFilter);
  }
}
