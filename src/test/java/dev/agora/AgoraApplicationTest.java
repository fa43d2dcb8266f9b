package dev.agora;

import static org.assertj.core.api.Assertions.assertThat;

import dev.agora.aggregation.ResultContainer;
import dev.agora.aggregation.ResultContainerFactory;
import dev.agora.engine.EngineDescriptor;
import dev.agora.engine.EngineRegistry;
import dev.agora.fixture.LegacyResultBuilder;
import dev.agora.search.BackendResponse;
import dev.agora.search.SearchBackend;
import dev.agora.search.SearchCoordinator;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class AgoraApplicationTest {

  @Autowired EngineRegistry engineRegistry;

  @Autowired ResultContainerFactory containerFactory;

  @Autowired SearchCoordinator searchCoordinator;

  @Autowired MeterRegistry meterRegistry;

  @Test
  void engine_registry_is_bound_from_application_yml() {
    assertThat(engineRegistry.weight("wikidata")).isEqualTo(2.0);
    assertThat(engineRegistry.find("startpage"))
        .map(EngineDescriptor::displayErrorMessages)
        .contains(false);
    assertThat(engineRegistry.find("duckduckgo"))
        .map(EngineDescriptor::categories)
        .contains(List.of("general", "web"));
  }

  @Test
  void search_runs_through_the_wired_stack() {
    SearchBackend duckduckgo =
        new SearchBackend() {
          @Override
          public String name() {
            return "duckduckgo";
          }

          @Override
          public BackendResponse search(String query) {
            return new BackendResponse(
                List.of(LegacyResultBuilder.standard("https://x.com/" + query).build()),
                Duration.ofMillis(3));
          }
        };

    ResultContainer container = searchCoordinator.search("adams", List.of(duckduckgo));

    assertThat(container.getOrderedResults()).hasSize(1);
    assertThat(container.isPaging()).isTrue();
    assertThat(
            meterRegistry
                .find("agora.engine.result.count")
                .tag("engine", "duckduckgo")
                .summary())
        .isNotNull();
  }

  @Test
  void factory_creates_independent_containers() {
    ResultContainer first = containerFactory.create();
    ResultContainer second = containerFactory.create();

    first.close();

    assertThat(first.isClosed()).isTrue();
    assertThat(second.isClosed()).isFalse();
  }
}
