package dev.agora.result;

/** Discriminant of the closed set of {@link Result} variants. */
public enum ResultKind {
  ANSWER,
  SUGGESTION,
  CORRECTION,
  INFOBOX,
  URL_RESULT,
  NO_URL_RESULT,
  ENGINE_DATA,
  RESULT_COUNT
}
