package dev.agora.url;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Lazy equivalence test between two URLs, used to detect the same page reported by different
 * engines.
 *
 * <ul>
 *   <li>{@code www.example.com} and {@code example.com} are equivalent
 *   <li>{@code example.com/path/} and {@code example.com/path} are equivalent
 *   <li>{@code https://example.com/} and {@code http://example.com/} are equivalent
 *   <li>query strings and fragments must match exactly
 *   <li>paths are compared percent-decoded
 *   <li>path parameters ({@code ;jsessionid=...}) are ignored
 * </ul>
 */
public final class UrlComparator {

  private static final String WWW_PREFIX = "www.";

  private UrlComparator() {
    // utility class
  }

  /**
   * Checks whether two parsed URLs denote the same resource.
   *
   * @param a first URL
   * @param b second URL
   * @return true if both URLs are equivalent
   */
  public static boolean equivalent(ParsedUrl a, ParsedUrl b) {
    if (!stripWww(a.host()).equals(stripWww(b.host()))
        || !a.query().equals(b.query())
        || !a.fragment().equals(b.fragment())) {
      return false;
    }
    return decode(stripTrailingSlash(a.path())).equals(decode(stripTrailingSlash(b.path())));
  }

  /** Convenience overload parsing both URL strings first. */
  public static boolean equivalent(String a, String b) {
    return equivalent(ParsedUrl.parse(a), ParsedUrl.parse(b));
  }

  private static String stripWww(String host) {
    return host.startsWith(WWW_PREFIX) ? host.substring(WWW_PREFIX.length()) : host;
  }

  private static String stripTrailingSlash(String path) {
    return path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
  }

  /**
   * Percent-decodes a path. Runs of valid escapes are decoded as UTF-8 (invalid bytes become
   * U+FFFD); malformed escapes such as {@code %zz} are kept as they are, and '+' stays a plus.
   */
  static String decode(String path) {
    if (path.indexOf('%') < 0) {
      return path;
    }
    StringBuilder decoded = new StringBuilder(path.length());
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    int i = 0;
    while (i < path.length()) {
      char c = path.charAt(i);
      if (c == '%' && i + 2 < path.length() && isEscape(path, i)) {
        bytes.write(Integer.parseInt(path.substring(i + 1, i + 3), 16));
        i += 3;
        continue;
      }
      flush(bytes, decoded);
      decoded.append(c);
      i++;
    }
    flush(bytes, decoded);
    return decoded.toString();
  }

  private static boolean isEscape(String path, int percent) {
    return isHexDigit(path.charAt(percent + 1)) && isHexDigit(path.charAt(percent + 2));
  }

  private static boolean isHexDigit(char c) {
    return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
  }

  private static void flush(ByteArrayOutputStream bytes, StringBuilder decoded) {
    if (bytes.size() > 0) {
      decoded.append(new String(bytes.toByteArray(), StandardCharsets.UTF_8));
      bytes.reset();
    }
  }
}
