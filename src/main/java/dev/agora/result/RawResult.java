package dev.agora.result;

/**
 * Anything an engine may hand to the aggregation layer: either an already typed {@link Result} or
 * an untyped {@link LegacyResult} that is classified on ingestion.
 */
public sealed interface RawResult permits Result, LegacyResult {}
