package dev.agora.aggregation;

import dev.agora.engine.EngineRegistry;
import dev.agora.result.MergedResult;
import dev.agora.result.Priority;

/**
 * Computes the ranking score of a merged result.
 *
 * <p>{@code weight = product of engine weights * number of positions}; every position then adds
 * {@code weight / position}, so results several engines agree on and rank high win. A {@link
 * Priority#HIGH} result gets the full weight per position regardless of rank, a {@link
 * Priority#LOW} result scores 0.
 */
public class ResultScorer {

  private final EngineRegistry engineRegistry;

  public ResultScorer(EngineRegistry engineRegistry) {
    this.engineRegistry = engineRegistry;
  }

  /**
   * @param result the merged result with its engines and positions
   * @param priority the priority to score with
   * @return the score, never negative
   */
  public double score(MergedResult result, Priority priority) {
    double weight = 1.0;
    for (String engine : result.getEngines()) {
      weight *= engineRegistry.weight(engine);
    }
    weight *= result.getPositions().size();

    double score = 0.0;
    for (int position : result.getPositions()) {
      switch (priority) {
        case LOW -> {
          // demoted: no contribution
        }
        case HIGH -> score += weight;
        case NORMAL -> score += weight / position;
      }
    }
    return score;
  }
}
