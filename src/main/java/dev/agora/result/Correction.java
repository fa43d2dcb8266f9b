package dev.agora.result;

import org.jspecify.annotations.Nullable;

/** A spelling correction for the query. */
public record Correction(@Nullable String engine, String correction) implements Result {

  @Override
  public ResultKind kind() {
    return ResultKind.CORRECTION;
  }
}
