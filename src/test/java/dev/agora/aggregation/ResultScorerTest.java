package dev.agora.aggregation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import dev.agora.engine.EngineDescriptor;
import dev.agora.engine.EngineRegistry;
import dev.agora.fixture.UrlResultBuilder;
import dev.agora.result.Priority;
import dev.agora.result.UrlResult;
import java.util.List;
import org.junit.jupiter.api.Test;

class ResultScorerTest {

  private final EngineRegistry registry =
      EngineRegistry.of(
          new EngineDescriptor("heavy", 2.0, List.of("general"), false, true),
          new EngineDescriptor("light", 0.5, List.of("general"), false, true));

  private final ResultScorer scorer = new ResultScorer(registry);

  @Test
  void single_first_position_of_neutral_engine_scores_one() {
    UrlResult result = new UrlResultBuilder().engine("unregistered").positions(1).build();

    assertThat(scorer.score(result, Priority.NORMAL)).isEqualTo(1.0);
  }

  @Test
  void rank_decays_the_contribution() {
    UrlResult first = new UrlResultBuilder().positions(1).build();
    UrlResult tenth = new UrlResultBuilder().positions(10).build();

    assertThat(scorer.score(first, Priority.NORMAL)).isEqualTo(1.0);
    assertThat(scorer.score(tenth, Priority.NORMAL)).isCloseTo(0.1, within(1e-9));
  }

  @Test
  void engine_weights_and_position_count_multiply() {
    UrlResult result = new UrlResultBuilder().engine("heavy").positions(1).build();
    result.addContribution("light", 2);

    // weight = 2.0 * 0.5 * 2 positions = 2.0; score = 2/1 + 2/2
    assertThat(scorer.score(result, Priority.NORMAL)).isCloseTo(3.0, within(1e-9));
  }

  @Test
  void high_priority_ignores_rank() {
    UrlResult result = new UrlResultBuilder().engine("heavy").positions(3, 7).build();

    // weight = 2.0 * 2 positions = 4.0, once per position
    assertThat(scorer.score(result, Priority.HIGH)).isCloseTo(8.0, within(1e-9));
  }

  @Test
  void low_priority_scores_zero() {
    UrlResult result = new UrlResultBuilder().engine("heavy").positions(1, 1, 1).build();

    assertThat(scorer.score(result, Priority.LOW)).isZero();
  }

  @Test
  void agreement_between_engines_beats_a_single_top_rank() {
    UrlResult agreed = new UrlResultBuilder().engine("a").positions(2).build();
    agreed.addContribution("b", 3);
    UrlResult single = new UrlResultBuilder().engine("c").positions(1).build();

    assertThat(scorer.score(agreed, Priority.NORMAL))
        .isGreaterThan(scorer.score(single, Priority.NORMAL));
  }
}
