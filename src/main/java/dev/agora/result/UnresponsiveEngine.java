package dev.agora.result;

/**
 * An engine that did not deliver results.
 *
 * @param engine the engine name
 * @param errorType classification of the failure ("timeout", "HTTP error", ...)
 * @param suspended whether the engine was suspended after the failure
 */
public record UnresponsiveEngine(String engine, String errorType, boolean suspended) {}
