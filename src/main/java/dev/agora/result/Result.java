package dev.agora.result;

import org.jspecify.annotations.Nullable;

/**
 * A typed search result. The set of variants is closed; ingestion dispatches on {@link #kind()}.
 */
public sealed interface Result extends RawResult
    permits Answer,
        Suggestion,
        Correction,
        Infobox,
        MergedResult,
        EngineDataEntry,
        ResultCountReport {

  ResultKind kind();

  /** Name of the engine that produced the result, or null for internally synthesized results. */
  @Nullable String engine();
}
