package dev.agora.result;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * State shared by the results that take part in scoring: the contributing engines, the position
 * each of them ranked the result at, and the score and category computed when the container
 * closes.
 *
 * <p>Instances are mutated in place while merging; the owning container serialises every
 * mutation.
 */
public abstract sealed class MergedResult implements Result permits UrlResult, NoUrlResult {

  private final String engine;
  private String title;
  private String content;
  private final String template;
  private @Nullable Priority priority;
  private final Map<String, Object> fields;
  private final Set<String> engines = new LinkedHashSet<>();
  private final List<Integer> positions = new ArrayList<>();
  private double score;
  private String category = "";

  protected MergedResult(
      String engine,
      String title,
      String content,
      String template,
      @Nullable Priority priority,
      Map<String, Object> fields) {
    this.engine = engine;
    this.title = title;
    this.content = content;
    this.template = template;
    this.priority = priority;
    this.fields = new LinkedHashMap<>(fields);
  }

  /** Engine that first reported the result. */
  @Override
  public String engine() {
    return engine;
  }

  public String getTitle() {
    return title;
  }

  public void setTitle(String title) {
    this.title = title;
  }

  public String getContent() {
    return content;
  }

  public void setContent(String content) {
    this.content = content;
  }

  /** Rendering shape of the result, e.g. {@code default.html} or {@code images.html}. */
  public String getTemplate() {
    return template;
  }

  /** The declared priority, {@link Priority#NORMAL} if the engines declared none. */
  public Priority getPriority() {
    return priority == null ? Priority.NORMAL : priority;
  }

  public boolean isPriorityDeclared() {
    return priority != null;
  }

  /** Additional engine specific fields (publishedDate, author, ...). */
  public Map<String, Object> getFields() {
    return fields;
  }

  public Set<String> getEngines() {
    return Collections.unmodifiableSet(engines);
  }

  public List<Integer> getPositions() {
    return Collections.unmodifiableList(positions);
  }

  public double getScore() {
    return score;
  }

  public void setScore(double score) {
    this.score = score;
  }

  /** Primary category of the reporting engine; assigned when the container closes. */
  public String getCategory() {
    return category;
  }

  public void setCategory(String category) {
    this.category = category;
  }

  /** Starts the merge bookkeeping: the reporting engine at the given 1-based position. */
  public void initContribution(String engine, int position) {
    engines.clear();
    positions.clear();
    engines.add(engine);
    positions.add(position);
  }

  /** Records one more engine that ranked this result at {@code position}. */
  public void addContribution(String engine, int position) {
    engines.add(engine);
    positions.add(position);
  }

  /**
   * Copies the priority, if none was declared here, and every additional field of {@code other}
   * that is missing or blank here.
   */
  protected void absorbMissingFields(MergedResult other) {
    if (priority == null) {
      priority = other.priority;
    }
    for (Map.Entry<String, Object> entry : other.fields.entrySet()) {
      if (isBlank(fields.get(entry.getKey()))) {
        fields.put(entry.getKey(), entry.getValue());
      }
    }
  }

  /** Null, empty text, empty collection, false and zero count as blank. */
  protected static boolean isBlank(@Nullable Object value) {
    if (value == null) {
      return true;
    }
    if (value instanceof CharSequence cs) {
      return cs.length() == 0;
    }
    if (value instanceof Collection<?> c) {
      return c.isEmpty();
    }
    if (value instanceof Map<?, ?> m) {
      return m.isEmpty();
    }
    if (value instanceof Boolean b) {
      return !b;
    }
    if (value instanceof Number n) {
      return n.doubleValue() == 0.0;
    }
    return false;
  }
}
