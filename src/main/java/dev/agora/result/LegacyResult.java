package dev.agora.result;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * An untyped result as most engines still produce it: a bag of named fields decoded from the
 * engine's response. Which kind of result it is depends on the fields present; see {@code
 * LegacyResultClassifier}.
 */
public final class LegacyResult implements RawResult {

  public static final String URL = "url";
  public static final String TITLE = "title";
  public static final String CONTENT = "content";
  public static final String ENGINE = "engine";
  public static final String TEMPLATE = "template";
  public static final String IMG_SRC = "img_src";
  public static final String THUMBNAIL = "thumbnail";
  public static final String PRIORITY = "priority";
  public static final String SUGGESTION = "suggestion";
  public static final String ANSWER = "answer";
  public static final String CORRECTION = "correction";
  public static final String INFOBOX = "infobox";
  public static final String NUMBER_OF_RESULTS = "number_of_results";
  public static final String ENGINE_DATA = "engine_data";
  public static final String KEY = "key";

  private final Map<String, Object> fields;

  private LegacyResult(Map<String, Object> fields) {
    this.fields = Collections.unmodifiableMap(fields);
  }

  public static LegacyResult of(Map<String, ?> fields) {
    return new LegacyResult(new LinkedHashMap<String, Object>(fields));
  }

  public boolean has(String field) {
    return fields.containsKey(field);
  }

  public @Nullable Object get(String field) {
    return fields.get(field);
  }

  /** Returns the field if it is text, null otherwise. */
  public @Nullable String getString(String field) {
    return fields.get(field) instanceof String s ? s : null;
  }

  public Map<String, Object> fields() {
    return fields;
  }

  @Override
  public String toString() {
    return "LegacyResult" + fields;
  }
}
