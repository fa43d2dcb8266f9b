package dev.agora.result;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

/**
 * Decodes a JSON array of result objects, as returned by JSON speaking engines, into {@link
 * LegacyResult}s. Field values keep their JSON types so that validation can reject, e.g., a
 * numeric title.
 */
public class LegacyResultReader {

  private static final TypeReference<List<Map<String, Object>>> RESULT_LIST =
      new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  public LegacyResultReader(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * @param json a JSON array of objects
   * @return one legacy result per object, in document order
   * @throws IllegalArgumentException if the text is not a JSON array of objects
   */
  public List<LegacyResult> read(String json) {
    try {
      return toResults(objectMapper.readValue(json, RESULT_LIST));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Malformed result batch: " + e.getOriginalMessage(), e);
    }
  }

  /**
   * @param in stream holding a JSON array of objects
   * @return one legacy result per object, in document order
   * @throws IOException if reading or decoding fails
   */
  public List<LegacyResult> read(InputStream in) throws IOException {
    return toResults(objectMapper.readValue(in, RESULT_LIST));
  }

  private static List<LegacyResult> toResults(List<Map<String, Object>> raw) {
    return raw.stream().map(LegacyResult::of).toList();
  }
}
