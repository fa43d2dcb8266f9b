package dev.agora.url;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A URL split into its components without any validation or normalisation.
 *
 * <p>Parsing is lenient and never fails: every string splits into (possibly empty) components
 * using the generic-syntax regular expression of RFC 3986, appendix B. Absent components are
 * represented by the empty string so that exact comparisons treat "missing" and "empty" alike.
 *
 * @param url the original URL string
 * @param scheme the scheme without the trailing colon (empty if absent)
 * @param host the raw authority (host, optional userinfo and port; empty if absent)
 * @param path the raw, still percent-encoded path, without parameters
 * @param params the {@code ;parameters} of the last path segment, without the leading {@code ;}
 * @param query the raw query without the leading {@code ?}
 * @param fragment the raw fragment without the leading {@code #}
 */
public record ParsedUrl(
    String url,
    String scheme,
    String host,
    String path,
    String params,
    String query,
    String fragment) {

  private static final Pattern RFC3986 =
      Pattern.compile("^(([^:/?#]+):)?(//([^/?#]*))?([^?#]*)(\\?([^#]*))?(#(.*))?");

  /**
   * Splits a URL string into its components.
   *
   * @param url the URL to split (must not be null)
   * @return the parsed URL
   */
  public static ParsedUrl parse(String url) {
    Matcher m = RFC3986.matcher(url);
    if (!m.matches()) {
      // the expression matches every string; kept for the compiler's benefit
      return new ParsedUrl(url, "", "", url, "", "", "");
    }
    String path = orEmpty(m.group(5));
    int semicolon = paramsStart(path);
    return new ParsedUrl(
        url,
        orEmpty(m.group(2)),
        orEmpty(m.group(4)),
        semicolon < 0 ? path : path.substring(0, semicolon),
        semicolon < 0 ? "" : path.substring(semicolon + 1),
        orEmpty(m.group(7)),
        orEmpty(m.group(9)));
  }

  // only the last segment carries parameters: "/a;x/b;y" has path "/a;x/b" and params "y"
  private static int paramsStart(String path) {
    int lastSlash = path.lastIndexOf('/');
    return path.indexOf(';', Math.max(lastSlash, 0));
  }

  /** Returns true if the scheme is {@code https}. */
  public boolean isSecure() {
    return "https".equalsIgnoreCase(scheme);
  }

  private static String orEmpty(String value) {
    return value == null ? "" : value;
  }
}
