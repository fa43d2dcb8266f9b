package dev.agora.engine;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised engine registry.
 *
 * <p>Properties are bound from {@code agora.engines.<name>.*} in application.yml:
 *
 * <ul>
 *   <li>{@code weight} - score multiplier (default 1.0, must be positive)
 *   <li>{@code categories} - engine categories, the first one is used for display grouping
 *   <li>{@code paging} - whether the engine can fetch further pages (default false)
 *   <li>{@code display-error-messages} - whether the engine's failures are reported (default true)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "agora")
public class EngineProperties {

  private Map<String, Engine> engines = new LinkedHashMap<>();

  /** Validates configuration at startup. Throws if a weight is not positive. */
  @PostConstruct
  void validate() {
    engines.forEach(
        (name, engine) -> {
          if (!(engine.getWeight() > 0.0)) {
            throw new IllegalStateException(
                "agora.engines." + name + ".weight must be positive, got: " + engine.getWeight());
          }
        });
  }

  public Map<String, Engine> getEngines() {
    return engines;
  }

  public void setEngines(Map<String, Engine> engines) {
    this.engines = engines;
  }

  /** Settings of a single engine. */
  public static class Engine {

    private double weight = EngineDescriptor.DEFAULT_WEIGHT;
    private List<String> categories = new ArrayList<>();
    private boolean paging;
    private boolean displayErrorMessages = true;

    public double getWeight() {
      return weight;
    }

    public void setWeight(double weight) {
      this.weight = weight;
    }

    public List<String> getCategories() {
      return categories;
    }

    public void setCategories(List<String> categories) {
      this.categories = categories;
    }

    public boolean isPaging() {
      return paging;
    }

    public void setPaging(boolean paging) {
      this.paging = paging;
    }

    public boolean isDisplayErrorMessages() {
      return displayErrorMessages;
    }

    public void setDisplayErrorMessages(boolean displayErrorMessages) {
      this.displayErrorMessages = displayErrorMessages;
    }

    EngineDescriptor toDescriptor(String name) {
      return new EngineDescriptor(name, weight, categories, paging, displayErrorMessages);
    }
  }
}
