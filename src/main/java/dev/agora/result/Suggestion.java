package dev.agora.result;

import org.jspecify.annotations.Nullable;

/** A query suggestion ("did you also mean ..."). */
public record Suggestion(@Nullable String engine, String suggestion) implements Result {

  @Override
  public ResultKind kind() {
    return ResultKind.SUGGESTION;
  }
}
