package dev.agora.result;

import java.time.Duration;

/**
 * How long an engine took to answer.
 *
 * @param engine the engine name
 * @param total total elapsed time, request included
 * @param load time spent loading the engine's page
 */
public record Timing(String engine, Duration total, Duration load) {}
