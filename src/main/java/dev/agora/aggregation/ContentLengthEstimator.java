package dev.agora.aggregation;

import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Estimates how much information a text carries, to decide which of two titles or contents to keep
 * when merging. The value is only meaningful relative to another estimate.
 */
public final class ContentLengthEstimator {

  /** {@code )-_} is a range: digits, upper case letters and most ASCII punctuation are ignored. */
  private static final Pattern IGNORED_CHARS = Pattern.compile("[,;:!?\\./\\\\ ()-_]");

  private ContentLengthEstimator() {
    // utility class
  }

  /**
   * @param value any value; only text has a length
   * @return number of characters left after removing ignored characters, 0 for non-text
   */
  public static int estimate(@Nullable Object value) {
    if (!(value instanceof String text)) {
      return 0;
    }
    return IGNORED_CHARS.matcher(text).replaceAll("").length();
  }
}
