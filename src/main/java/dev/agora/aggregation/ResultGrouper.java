package dev.agora.aggregation;

import dev.agora.engine.EngineRegistry;
import dev.agora.result.MergedResult;
import dev.agora.result.UrlResult;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Second pass of finalization: turns the score-sorted merged results into the display order.
 *
 * <p>Results are keyed by {@code primaryCategory:template:imageMarker}. A result whose key was seen
 * recently is pulled up next to the previous results of that key, so results of one kind are shown
 * together, at most {@value #GROUP_SIZE} at a time and only while the group started less than
 * {@value #MAX_DISTANCE} slots back. Otherwise it is appended and starts a new group.
 */
public class ResultGrouper {

  static final int GROUP_SIZE = 8;
  static final int MAX_DISTANCE = 20;

  private static final String IMAGE_MARKER = "img_src";

  private final EngineRegistry engineRegistry;

  public ResultGrouper(EngineRegistry engineRegistry) {
    this.engineRegistry = engineRegistry;
  }

  /**
   * Builds the display order. Results without URL are dropped; each kept result gets its category
   * assigned. The input list is not modified.
   *
   * @param sortedByScore merged results, best score first
   * @return a new list in display order
   */
  public List<UrlResult> group(List<? extends MergedResult> sortedByScore) {
    List<UrlResult> grouped = new ArrayList<>(sortedByScore.size());
    Map<String, GroupSlot> slots = new HashMap<>();

    for (MergedResult merged : sortedByScore) {
      if (!(merged instanceof UrlResult result) || result.getUrl().isEmpty()) {
        continue;
      }
      String category = engineRegistry.primaryCategory(result.engine());
      result.setCategory(category);
      String key = categoryKey(category, result);

      GroupSlot current = slots.get(key);
      if (current != null
          && current.remaining > 0
          && grouped.size() - current.index < MAX_DISTANCE) {
        int index = current.index;
        grouped.add(index, result);
        // every group at or after the insertion point moves one slot down
        for (GroupSlot slot : slots.values()) {
          if (slot.index >= index) {
            slot.index++;
          }
        }
        current.remaining--;
      } else {
        grouped.add(result);
        slots.put(key, new GroupSlot(grouped.size(), GROUP_SIZE));
      }
    }
    return grouped;
  }

  static String categoryKey(String category, UrlResult result) {
    return category + ":" + result.getTemplate() + ":" + (result.hasImage() ? IMAGE_MARKER : "");
  }

  /** Insertion point for the next result of a group and how many more the group takes. */
  private static final class GroupSlot {
    private int index;
    private int remaining;

    private GroupSlot(int index, int remaining) {
      this.index = index;
      this.remaining = remaining;
    }
  }
}
