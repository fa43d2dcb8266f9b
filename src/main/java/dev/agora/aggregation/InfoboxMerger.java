package dev.agora.aggregation;

import dev.agora.engine.EngineRegistry;
import dev.agora.result.Infobox;
import dev.agora.result.InfoboxAttribute;
import dev.agora.result.InfoboxUrl;
import dev.agora.url.UrlComparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Merges two infoboxes about the same topic, reported by different engines, into the first one.
 *
 * <p>Steps, in order:
 *
 * <ol>
 *   <li>if the incoming engine weighs strictly more, it becomes the primary engine
 *   <li>the engine sets are united
 *   <li>incoming links are appended unless an existing link has the same entity or an equivalent
 *       URL
 *   <li>the incoming image is taken if there is none yet or the incoming engine weighs more
 *   <li>incoming attributes are appended if neither their label nor their entity is known yet;
 *       a missing label or entity counts as a value of its own
 *   <li>the incoming content is taken if there is none yet or it is longer
 * </ol>
 */
public class InfoboxMerger {

  private final EngineRegistry engineRegistry;

  public InfoboxMerger(EngineRegistry engineRegistry) {
    this.engineRegistry = engineRegistry;
  }

  /**
   * Merges {@code incoming} into {@code existing}. Only {@code existing} is modified.
   *
   * @param existing the infobox kept by the container
   * @param incoming an infobox whose identifier is equivalent to the existing one's
   */
  public void merge(Infobox existing, Infobox incoming) {
    double existingWeight = engineRegistry.weight(existing.engine());
    double incomingWeight = engineRegistry.weight(incoming.engine());
    boolean incomingWeighsMore = incomingWeight > existingWeight;

    if (incomingWeighsMore) {
      existing.setEngine(incoming.engine());
    }
    existing.getEngines().addAll(incoming.getEngines());

    mergeUrls(existing.getUrls(), incoming.getUrls());

    if (incoming.getImgSrc() != null && (existing.getImgSrc() == null || incomingWeighsMore)) {
      existing.setImgSrc(incoming.getImgSrc());
    }

    mergeAttributes(existing.getAttributes(), incoming.getAttributes());

    if (incoming.getContent() != null
        && (existing.getContent() == null
            || ContentLengthEstimator.estimate(incoming.getContent())
                > ContentLengthEstimator.estimate(existing.getContent()))) {
      existing.setContent(incoming.getContent());
    }
  }

  // links appended here are compared against the following incoming ones too
  private static void mergeUrls(List<InfoboxUrl> existingUrls, List<InfoboxUrl> incomingUrls) {
    for (InfoboxUrl candidate : incomingUrls) {
      boolean unique = true;
      for (InfoboxUrl known : existingUrls) {
        boolean sameEntity =
            candidate.entity() != null && candidate.entity().equals(known.entity());
        if (sameEntity || UrlComparator.equivalent(known.url(), candidate.url())) {
          unique = false;
          break;
        }
      }
      if (unique) {
        existingUrls.add(candidate);
      }
    }
  }

  private static void mergeAttributes(
      List<InfoboxAttribute> existingAttributes, List<InfoboxAttribute> incomingAttributes) {
    // an absent label or entity is recorded as null: it blocks incoming attributes lacking it too
    Set<@Nullable String> known = new HashSet<>();
    for (InfoboxAttribute attribute : existingAttributes) {
      known.add(attribute.label());
      known.add(attribute.entity());
    }
    for (InfoboxAttribute attribute : incomingAttributes) {
      if (!known.contains(attribute.label()) && !known.contains(attribute.entity())) {
        existingAttributes.add(attribute);
      }
    }
  }
}
