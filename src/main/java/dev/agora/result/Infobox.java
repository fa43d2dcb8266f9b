package dev.agora.result;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * A fact panel about one topic. Infoboxes with equivalent identifiers reported by different
 * engines are merged in place into the first one received; instances are therefore mutable and
 * must only be modified under the owning container's lock.
 */
public final class Infobox implements Result {

  private String engine;
  private final String title;
  private final @Nullable String id;
  private final Set<String> engines = new LinkedHashSet<>();
  private @Nullable String content;
  private @Nullable String imgSrc;
  private final List<InfoboxAttribute> attributes;
  private final List<InfoboxUrl> urls;

  public Infobox(
      String engine,
      String title,
      @Nullable String id,
      @Nullable String content,
      @Nullable String imgSrc,
      List<InfoboxAttribute> attributes,
      List<InfoboxUrl> urls) {
    this.engine = engine;
    this.title = title;
    this.id = id;
    this.content = content;
    this.imgSrc = imgSrc;
    this.attributes = new ArrayList<>(attributes);
    this.urls = new ArrayList<>(urls);
    this.engines.add(engine);
  }

  @Override
  public ResultKind kind() {
    return ResultKind.INFOBOX;
  }

  /** The primary engine, i.e. the highest weighted contributor seen so far. */
  @Override
  public String engine() {
    return engine;
  }

  public void setEngine(String engine) {
    this.engine = engine;
  }

  public String getTitle() {
    return title;
  }

  /** URL-like identifier used to detect the same topic across engines; may be absent. */
  public @Nullable String getId() {
    return id;
  }

  public Set<String> getEngines() {
    return engines;
  }

  public @Nullable String getContent() {
    return content;
  }

  public void setContent(@Nullable String content) {
    this.content = content;
  }

  public @Nullable String getImgSrc() {
    return imgSrc;
  }

  public void setImgSrc(@Nullable String imgSrc) {
    this.imgSrc = imgSrc;
  }

  public List<InfoboxAttribute> getAttributes() {
    return attributes;
  }

  public List<InfoboxUrl> getUrls() {
    return urls;
  }

  @Override
  public String toString() {
    return "Infobox[title=" + title + ", id=" + id + ", engines=" + engines + "]";
  }
}
