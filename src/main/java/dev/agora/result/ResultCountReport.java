package dev.agora.result;

import org.jspecify.annotations.Nullable;

/** The total number of hits an engine claims to have for the query. */
public record ResultCountReport(@Nullable String engine, long numberOfResults) implements Result {

  @Override
  public ResultKind kind() {
    return ResultKind.RESULT_COUNT;
  }
}
