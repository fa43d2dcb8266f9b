package dev.agora.aggregation;

import static dev.agora.result.LegacyResult.ANSWER;
import static dev.agora.result.LegacyResult.CONTENT;
import static dev.agora.result.LegacyResult.CORRECTION;
import static dev.agora.result.LegacyResult.ENGINE;
import static dev.agora.result.LegacyResult.ENGINE_DATA;
import static dev.agora.result.LegacyResult.IMG_SRC;
import static dev.agora.result.LegacyResult.INFOBOX;
import static dev.agora.result.LegacyResult.KEY;
import static dev.agora.result.LegacyResult.NUMBER_OF_RESULTS;
import static dev.agora.result.LegacyResult.PRIORITY;
import static dev.agora.result.LegacyResult.SUGGESTION;
import static dev.agora.result.LegacyResult.TEMPLATE;
import static dev.agora.result.LegacyResult.THUMBNAIL;
import static dev.agora.result.LegacyResult.TITLE;
import static dev.agora.result.LegacyResult.URL;

import dev.agora.result.Answer;
import dev.agora.result.Correction;
import dev.agora.result.EngineDataEntry;
import dev.agora.result.Infobox;
import dev.agora.result.InfoboxAttribute;
import dev.agora.result.InfoboxUrl;
import dev.agora.result.LegacyResult;
import dev.agora.result.NoUrlResult;
import dev.agora.result.Priority;
import dev.agora.result.Result;
import dev.agora.result.ResultCountReport;
import dev.agora.result.Suggestion;
import dev.agora.result.UrlResult;
import dev.agora.url.ParsedUrl;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns an untyped {@link LegacyResult} into a typed {@link Result} based on which fields it
 * carries, checked in this order: {@code suggestion}, {@code answer}, {@code correction}, {@code
 * infobox}, {@code number_of_results}, {@code engine_data}, {@code url}; anything else becomes a
 * {@link NoUrlResult}.
 *
 * <p>URL-bearing entries are validated (url, title and content must be text when present) and
 * normalised (trimmed URL with a scheme, default template, parsed priority).
 */
public final class LegacyResultClassifier {

  private static final Logger log = LoggerFactory.getLogger(LegacyResultClassifier.class);

  static final String INVALID_URL = "invalid URL";
  static final String INVALID_TITLE = "invalid title";
  static final String INVALID_CONTENT = "invalid content";

  /** Fields with a typed home in {@link UrlResult}; everything else is kept as additional field. */
  private static final Set<String> TYPED_FIELDS =
      Set.of(URL, TITLE, CONTENT, ENGINE, TEMPLATE, IMG_SRC, THUMBNAIL, PRIORITY);

  private LegacyResultClassifier() {
    // utility class
  }

  /**
   * Classifies one legacy result.
   *
   * @param legacy the untyped result
   * @param batchEngine engine of the batch, used when the result names none
   * @param errors receives the validation message of a rejected result
   * @return the typed result, or null if the entry is invalid
   */
  public static @Nullable Result classify(
      LegacyResult legacy, @Nullable String batchEngine, Set<String> errors) {
    String engine = resolveEngine(legacy, batchEngine);

    if (legacy.has(SUGGESTION)) {
      return new Suggestion(engine, text(legacy.get(SUGGESTION)));
    }
    if (legacy.has(ANSWER)) {
      log.warn(
          "answer results from engine {} are without typification / migrate to Answer", engine);
      return new Answer(engine, text(legacy.get(ANSWER)), legacy.getString(URL));
    }
    if (legacy.has(CORRECTION)) {
      return new Correction(engine, text(legacy.get(CORRECTION)));
    }
    if (legacy.has(INFOBOX)) {
      return toInfobox(legacy, engine);
    }
    if (legacy.has(NUMBER_OF_RESULTS)) {
      return toResultCount(legacy, engine);
    }
    if (legacy.has(ENGINE_DATA)) {
      return new EngineDataEntry(
          engine, text(legacy.get(KEY)), text(legacy.get(ENGINE_DATA)));
    }
    if (isPresent(legacy.get(URL))) {
      return toUrlResult(legacy, engine, errors);
    }
    return new NoUrlResult(
        engine,
        textOrEmpty(legacy.get(TITLE)),
        textOrEmpty(legacy.get(CONTENT)),
        templateOf(legacy),
        priorityOf(legacy),
        additionalFields(legacy));
  }

  private static @Nullable UrlResult toUrlResult(
      LegacyResult legacy, String engine, Set<String> errors) {
    if (!isValid(legacy, errors)) {
      return null;
    }
    return new UrlResult(
        engine,
        normalizeUrl(legacy.getString(URL)),
        textOrEmpty(legacy.get(TITLE)),
        textOrEmpty(legacy.get(CONTENT)),
        templateOf(legacy),
        legacy.getString(IMG_SRC),
        legacy.getString(THUMBNAIL),
        priorityOf(legacy),
        additionalFields(legacy));
  }

  static boolean isValid(LegacyResult legacy, Set<String> errors) {
    if (legacy.has(URL) && !(legacy.get(URL) instanceof String)) {
      log.debug("result: invalid URL: {}", legacy);
      errors.add(INVALID_URL);
      return false;
    }
    if (legacy.has(TITLE) && !(legacy.get(TITLE) instanceof String)) {
      log.debug("result: invalid title: {}", legacy);
      errors.add(INVALID_TITLE);
      return false;
    }
    if (legacy.has(CONTENT) && !(legacy.get(CONTENT) instanceof String)) {
      log.debug("result: invalid content: {}", legacy);
      errors.add(INVALID_CONTENT);
      return false;
    }
    return true;
  }

  /** Trims the URL and defaults a missing scheme to {@code http}. */
  static String normalizeUrl(String url) {
    String trimmed = url.strip();
    if (!ParsedUrl.parse(trimmed).scheme().isEmpty()) {
      return trimmed;
    }
    return trimmed.startsWith("//") ? "http:" + trimmed : "http://" + trimmed;
  }

  private static Infobox toInfobox(LegacyResult legacy, String engine) {
    return new Infobox(
        engine,
        text(legacy.get(INFOBOX)),
        legacy.getString("id"),
        legacy.getString(CONTENT),
        legacy.getString(IMG_SRC),
        attributes(legacy.get("attributes")),
        urls(legacy.get("urls")));
  }

  private static @Nullable ResultCountReport toResultCount(LegacyResult legacy, String engine) {
    Object raw = legacy.get(NUMBER_OF_RESULTS);
    if (raw instanceof Number n) {
      return new ResultCountReport(engine, n.longValue());
    }
    if (raw instanceof String s) {
      try {
        return new ResultCountReport(engine, Long.parseLong(s.strip()));
      } catch (NumberFormatException e) {
        log.debug("result: invalid number_of_results from {}: {}", engine, s);
      }
    }
    return null;
  }

  private static List<InfoboxAttribute> attributes(@Nullable Object raw) {
    List<InfoboxAttribute> attributes = new ArrayList<>();
    if (raw instanceof List<?> list) {
      for (Object item : list) {
        if (item instanceof Map<?, ?> map) {
          attributes.add(
              new InfoboxAttribute(
                  stringOrNull(map.get("label")),
                  stringOrNull(map.get("entity")),
                  textOrEmpty(map.get("value"))));
        }
      }
    }
    return attributes;
  }

  private static List<InfoboxUrl> urls(@Nullable Object raw) {
    List<InfoboxUrl> urls = new ArrayList<>();
    if (raw instanceof List<?> list) {
      for (Object item : list) {
        if (item instanceof Map<?, ?> map) {
          urls.add(
              new InfoboxUrl(
                  textOrEmpty(map.get("title")),
                  textOrEmpty(map.get("url")),
                  stringOrNull(map.get("entity"))));
        }
      }
    }
    return urls;
  }

  private static Map<String, Object> additionalFields(LegacyResult legacy) {
    Map<String, Object> fields = new LinkedHashMap<>();
    legacy
        .fields()
        .forEach(
            (name, value) -> {
              if (!TYPED_FIELDS.contains(name)) {
                fields.put(name, value);
              }
            });
    return fields;
  }

  private static String resolveEngine(LegacyResult legacy, @Nullable String batchEngine) {
    String own = legacy.getString(ENGINE);
    if (own != null && !own.isEmpty()) {
      return own;
    }
    return batchEngine == null ? "" : batchEngine;
  }

  /** Parsed priority, or null if the entry declares none so a duplicate may supply it. */
  private static @Nullable Priority priorityOf(LegacyResult legacy) {
    Object raw = legacy.get(PRIORITY);
    return isPresent(raw) ? Priority.parse(raw) : null;
  }

  private static String templateOf(LegacyResult legacy) {
    String template = legacy.getString(TEMPLATE);
    return template == null || template.isEmpty() ? UrlResult.DEFAULT_TEMPLATE : template;
  }

  /** Python-like truthiness: null, empty text and false are absent. */
  private static boolean isPresent(@Nullable Object value) {
    if (value == null || Boolean.FALSE.equals(value)) {
      return false;
    }
    return !(value instanceof String s) || !s.isEmpty();
  }

  private static String text(@Nullable Object value) {
    return String.valueOf(value);
  }

  private static String textOrEmpty(@Nullable Object value) {
    return value == null ? "" : String.valueOf(value);
  }

  private static @Nullable String stringOrNull(@Nullable Object value) {
    return value instanceof String s ? s : null;
  }
}
