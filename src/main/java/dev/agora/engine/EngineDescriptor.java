package dev.agora.engine;

import java.util.List;

/**
 * What the aggregation layer needs to know about an engine.
 *
 * @param name unique engine name
 * @param weight multiplier applied to the engine's contribution to a result's score
 * @param categories the engine's categories; the first one is its primary category
 * @param paging whether the engine supports fetching further result pages
 * @param displayErrorMessages whether failures of the engine are shown to the user
 */
public record EngineDescriptor(
    String name,
    double weight,
    List<String> categories,
    boolean paging,
    boolean displayErrorMessages) {

  public static final double DEFAULT_WEIGHT = 1.0;

  public EngineDescriptor {
    categories = categories == null ? List.of() : List.copyOf(categories);
  }

  /** An engine with neutral weight, no category, no paging, and visible errors. */
  public static EngineDescriptor withDefaults(String name) {
    return new EngineDescriptor(name, DEFAULT_WEIGHT, List.of(), false, true);
  }

  /** First category, or the empty string if the engine declares none. */
  public String primaryCategory() {
    return categories.isEmpty() ? "" : categories.get(0);
  }
}
