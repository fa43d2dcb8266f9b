package dev.agora.result;

import dev.agora.url.ParsedUrl;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** A standard, URL-bearing search result (title, content and link). */
public final class UrlResult extends MergedResult {

  /** Template of image results; those are only duplicates if their image source matches. */
  public static final String IMAGES_TEMPLATE = "images.html";

  public static final String DEFAULT_TEMPLATE = "default.html";

  private String url;
  private ParsedUrl parsedUrl;
  private @Nullable String imgSrc;
  private @Nullable String thumbnail;

  public UrlResult(
      String engine,
      String url,
      String title,
      String content,
      String template,
      @Nullable String imgSrc,
      @Nullable String thumbnail,
      @Nullable Priority priority,
      Map<String, Object> fields) {
    super(engine, title, content, template, priority, fields);
    this.url = url;
    this.parsedUrl = ParsedUrl.parse(url);
    this.imgSrc = imgSrc;
    this.thumbnail = thumbnail;
  }

  @Override
  public ResultKind kind() {
    return ResultKind.URL_RESULT;
  }

  public String getUrl() {
    return url;
  }

  public ParsedUrl getParsedUrl() {
    return parsedUrl;
  }

  public @Nullable String getImgSrc() {
    return imgSrc;
  }

  public @Nullable String getThumbnail() {
    return thumbnail;
  }

  /** True if the result carries an image or a thumbnail reference. */
  public boolean hasImage() {
    return imgSrc != null || thumbnail != null;
  }

  /** Switches to the URL of {@code other}, e.g. to prefer its secure transport. */
  public void adoptUrl(UrlResult other) {
    this.url = other.url;
    this.parsedUrl = other.parsedUrl;
  }

  /**
   * Copies every field of {@code other} that is missing or blank here: the image references, the
   * priority and the additional fields. Title, content and URL have their own merge rules.
   */
  public void absorbMissingFields(UrlResult other) {
    if (isBlank(imgSrc)) {
      imgSrc = other.imgSrc;
    }
    if (isBlank(thumbnail)) {
      thumbnail = other.thumbnail;
    }
    super.absorbMissingFields(other);
  }

  @Override
  public String toString() {
    return "UrlResult[url=" + url + ", engines=" + getEngines() + ", score=" + getScore() + "]";
  }
}
