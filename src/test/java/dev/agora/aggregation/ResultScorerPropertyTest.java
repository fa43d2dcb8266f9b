package dev.agora.aggregation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import dev.agora.engine.EngineDescriptor;
import dev.agora.engine.EngineRegistry;
import dev.agora.fixture.UrlResultBuilder;
import dev.agora.result.Priority;
import dev.agora.result.UrlResult;
import java.util.List;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;

/** Property-based tests for {@link ResultScorer} over arbitrary position histories. */
class ResultScorerPropertyTest {

  private final ResultScorer scorer =
      new ResultScorer(
          EngineRegistry.of(new EngineDescriptor("engine", 1.5, List.of(), false, true)));

  private static UrlResult withPositions(List<Integer> positions) {
    return new UrlResultBuilder()
        .engine("engine")
        .positions(positions.stream().mapToInt(Integer::intValue).toArray())
        .build();
  }

  @Property
  void low_priority_is_always_zero(
      @ForAll @Size(min = 1, max = 10) List<@IntRange(min = 1, max = 100) Integer> positions) {
    assertThat(scorer.score(withPositions(positions), Priority.LOW)).isZero();
  }

  @Property
  void high_priority_is_weight_times_position_count(
      @ForAll @Size(min = 1, max = 10) List<@IntRange(min = 1, max = 100) Integer> positions) {
    double weight = 1.5 * positions.size();

    assertThat(scorer.score(withPositions(positions), Priority.HIGH))
        .isCloseTo(weight * positions.size(), within(1e-9));
  }

  @Property
  void neutral_priority_never_exceeds_high_priority(
      @ForAll @Size(min = 1, max = 10) List<@IntRange(min = 1, max = 100) Integer> positions) {
    UrlResult result = withPositions(positions);

    assertThat(scorer.score(result, Priority.NORMAL))
        .isPositive()
        .isLessThanOrEqualTo(scorer.score(result, Priority.HIGH) + 1e-9);
  }
}
