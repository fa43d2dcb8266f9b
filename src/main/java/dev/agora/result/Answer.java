package dev.agora.result;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A direct answer to the query (unit conversion, calculator output, ...). Two answers are equal if
 * they carry the same text and link, whichever engine produced them.
 *
 * @param engine the producing engine
 * @param answer the answer text
 * @param url optional link to the answer's source
 */
public record Answer(@Nullable String engine, String answer, @Nullable String url)
    implements Result {

  public Answer {
    Objects.requireNonNull(answer, "answer");
  }

  public Answer(String answer) {
    this(null, answer, null);
  }

  @Override
  public ResultKind kind() {
    return ResultKind.ANSWER;
  }

  /** Returns a copy attributed to {@code engine} unless this answer already names one. */
  public Answer withDefaultEngine(@Nullable String engine) {
    return this.engine != null ? this : new Answer(engine, answer, url);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Answer other)) {
      return false;
    }
    return answer.equals(other.answer) && Objects.equals(url, other.url);
  }

  @Override
  public int hashCode() {
    return Objects.hash(answer, url);
  }
}
