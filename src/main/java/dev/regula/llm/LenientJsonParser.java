package dev.regula.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/**
 * Reads JSON from model output that may wrap the object in prose.
 *
 * <p>Two stages: a direct parse of the whole text, then a parse of the substring from the first
 * {@code '{'} to the last {@code '}'}. Nothing smarter than that (no repair of truncated or
 * single-quoted JSON).
 */
@Component
public class LenientJsonParser {

  private final ObjectMapper objectMapper;

  public LenientJsonParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Parses the raw text into the given type.
   *
   * @param raw model output
   * @param type target type
   * @return the parsed value
   * @throws JsonExtractionException if neither stage yields a valid value
   */
  public <T> T parse(String raw, Class<T> type) {
    try {
      return read(raw, type);
    } catch (JsonProcessingException direct) {
      int start = raw.indexOf('{');
      int end = raw.lastIndexOf('}');
      if (start < 0 || end <= start) {
        throw new JsonExtractionException("No JSON object in model output", direct);
      }
      try {
        return read(raw.substring(start, end + 1), type);
      } catch (JsonProcessingException extracted) {
        extracted.addSuppressed(direct);
        throw new JsonExtractionException(
            "Model output is not valid JSON: " + extracted.getOriginalMessage(), extracted);
      }
    }
  }

  private <T> T read(String json, Class<T> type) throws JsonProcessingException {
    T value = objectMapper.readValue(json, type);
    if (value == null) {
      throw new JsonMappingException(null, "JSON literal null where an object was expected");
    }
    return value;
  }
}
