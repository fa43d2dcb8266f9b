package dev.agora.result;

import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A result without a link. It takes part in scoring but is dropped from the display order when
 * the container closes.
 */
public final class NoUrlResult extends MergedResult {

  public NoUrlResult(
      String engine,
      String title,
      String content,
      String template,
      @Nullable Priority priority,
      Map<String, Object> fields) {
    super(engine, title, content, template, priority, fields);
  }

  @Override
  public ResultKind kind() {
    return ResultKind.NO_URL_RESULT;
  }
}
