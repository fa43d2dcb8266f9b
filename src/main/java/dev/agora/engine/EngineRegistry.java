package dev.agora.engine;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/** Read-only lookup of engine settings by engine name. */
public interface EngineRegistry {

  /**
   * @param engineName the engine to look up; null for internally synthesized results
   * @return the engine's settings, or empty if no such engine is registered
   */
  Optional<EngineDescriptor> find(@Nullable String engineName);

  /** True if the engine is registered. */
  default boolean isRegistered(@Nullable String engineName) {
    return find(engineName).isPresent();
  }

  /** Declared weight of the engine, {@link EngineDescriptor#DEFAULT_WEIGHT} if unknown. */
  default double weight(@Nullable String engineName) {
    return find(engineName).map(EngineDescriptor::weight).orElse(EngineDescriptor.DEFAULT_WEIGHT);
  }

  /** Primary category of the engine, the empty string if unknown or uncategorised. */
  default String primaryCategory(@Nullable String engineName) {
    return find(engineName).map(EngineDescriptor::primaryCategory).orElse("");
  }

  /** Builds a fixed registry from explicit descriptors, e.g. for tests or embedded use. */
  static EngineRegistry of(EngineDescriptor... descriptors) {
    Map<String, EngineDescriptor> byName =
        Arrays.stream(descriptors)
            .collect(
                Collectors.toUnmodifiableMap(
                    EngineDescriptor::name, Function.identity(), (first, second) -> second));
    return engineName ->
        engineName == null ? Optional.empty() : Optional.ofNullable(byName.get(engineName));
  }
}
