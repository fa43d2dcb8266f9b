package dev.agora.result;

/**
 * Opaque state an engine wants back on the next request (e.g. a paging token).
 *
 * @param engine the engine owning the value
 * @param key the entry key
 * @param value the entry value
 */
public record EngineDataEntry(String engine, String key, String value) implements Result {

  @Override
  public ResultKind kind() {
    return ResultKind.ENGINE_DATA;
  }
}
