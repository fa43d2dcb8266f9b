package dev.agora.result;

import java.util.Locale;
import org.jspecify.annotations.Nullable;

/** Ranking hint carried by a result; overrides the usual rank decay when scoring. */
public enum Priority {
  HIGH,
  NORMAL,
  LOW;

  /**
   * Parses a raw priority value. {@code "high"} and {@code "low"} (any case) map to their
   * constants, everything else is {@link #NORMAL}.
   */
  public static Priority parse(@Nullable Object raw) {
    if (!(raw instanceof String s)) {
      return NORMAL;
    }
    return switch (s.trim().toLowerCase(Locale.ROOT)) {
      case "high" -> HIGH;
      case "low" -> LOW;
      default -> NORMAL;
    };
  }
}
