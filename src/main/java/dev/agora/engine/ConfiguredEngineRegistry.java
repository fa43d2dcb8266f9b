package dev.agora.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/** {@link EngineRegistry} over the engines declared in {@link EngineProperties}. */
@Component
public class ConfiguredEngineRegistry implements EngineRegistry {

  private final Map<String, EngineDescriptor> engines;

  public ConfiguredEngineRegistry(EngineProperties properties) {
    Map<String, EngineDescriptor> byName = new LinkedHashMap<>();
    properties.getEngines().forEach((name, engine) -> byName.put(name, engine.toDescriptor(name)));
    this.engines = Collections.unmodifiableMap(byName);
  }

  @Override
  public Optional<EngineDescriptor> find(@Nullable String engineName) {
    if (engineName == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(engines.get(engineName));
  }
}
