package dev.agora.result;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class AnswerTest {

  @Test
  void equality_ignores_engine() {
    Answer fromDdg = new Answer("ddg", "42", "https://x.com/42");
    Answer fromWikipedia = new Answer("wikipedia", "42", "https://x.com/42");

    assertThat(fromDdg).isEqualTo(fromWikipedia).hasSameHashCodeAs(fromWikipedia);
  }

  @Test
  void different_url_is_a_different_answer() {
    assertThat(new Answer("ddg", "42", "https://x.com/42"))
        .isNotEqualTo(new Answer("ddg", "42", null));
  }

  @Test
  void default_engine_only_fills_a_missing_engine() {
    assertThat(new Answer("42").withDefaultEngine("ddg").engine()).isEqualTo("ddg");
    assertThat(new Answer("wikipedia", "42", null).withDefaultEngine("ddg").engine())
        .isEqualTo("wikipedia");
  }
}
