package dev.agora.result;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import org.junit.jupiter.api.Test;

class LegacyResultReaderTest {

  private final LegacyResultReader reader = new LegacyResultReader(new ObjectMapper());

  @Test
  void reads_batch_in_document_order_keeping_json_types() throws IOException {
    List<LegacyResult> results;
    try (InputStream in = getClass().getResourceAsStream("/fixtures/duckduckgo-batch.json")) {
      results = reader.read(in);
    }

    assertThat(results).hasSize(5);
    assertThat(results.get(0).getString(LegacyResult.URL))
        .isEqualTo("https://en.wikipedia.org/wiki/Douglas_Adams");
    assertThat(results.get(0).fields())
        .containsKeys("url", "title", "content", "publishedDate")
        .hasSize(4);
    assertThat(results.get(1).get(LegacyResult.TITLE)).isEqualTo(42);
    assertThat(results.get(1).getString(LegacyResult.TITLE)).isNull();
    assertThat(results.get(2).has(LegacyResult.SUGGESTION)).isTrue();
    assertThat(results.get(3).get(LegacyResult.NUMBER_OF_RESULTS)).isEqualTo(15400);
  }

  @Test
  void empty_array_yields_no_results() {
    assertThat(reader.read("[]")).isEmpty();
  }

  @Test
  void malformed_json_is_rejected() {
    assertThatThrownBy(() -> reader.read("[{\"url\": "))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageStartingWith("Malformed result batch");
  }

  @Test
  void non_array_json_is_rejected() {
    assertThatThrownBy(() -> reader.read("{\"url\": \"https://x.com\"}"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void fields_are_read_only() {
    LegacyResult result = reader.read("[{\"url\": \"https://x.com\"}]").get(0);

    assertThatThrownBy(() -> result.fields().put("title", "x"))
        .isInstanceOf(UnsupportedOperationException.class);
  }
}
