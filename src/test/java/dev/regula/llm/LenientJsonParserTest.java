package dev.regula.llm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LenientJsonParserTest {

  record Sample(String name, int count) {}

  private final LenientJsonParser parser = new LenientJsonParser(new ObjectMapper());

  @Test
  void parsesCleanJsonDirectly() {
    assertThat(parser.parse("{\"name\":\"doors\",\"count\":2}", Sample.class))
        .isEqualTo(new Sample("doors", 2));
  }

  @Test
  void extractsObjectWrappedInProse() {
    String raw = "Here you go:\n```json\n{\"name\":\"stairs\",\"count\":1}\n```\nHope this helps!";

    assertThat(parser.parse(raw, Sample.class)).isEqualTo(new Sample("stairs", 1));
  }

  @Test
  void extractionSpansFirstOpeningToLastClosingBrace() {
    String raw = "Result: {\"outer\": {\"inner\": 1}} done";

    @SuppressWarnings("unchecked")
    Map<String, Object> parsed = parser.parse(raw, Map.class);

    assertThat(parsed).containsKey("outer");
  }

  @Test
  void textWithoutBracesFails() {
    assertThatThrownBy(() -> parser.parse("I cannot answer that.", Sample.class))
        .isInstanceOf(JsonExtractionException.class)
        .hasMessageContaining("No JSON object");
  }

  @Test
  void brokenJsonInsideBracesFails() {
    assertThatThrownBy(() -> parser.parse("Sure! {\"name\": \"x\", } Thanks", Sample.class))
        .isInstanceOf(JsonExtractionException.class)
        .hasMessageContaining("not valid JSON");
  }

  @Test
  void jsonNullIsRejected() {
    assertThatThrownBy(() -> parser.parse("null", Sample.class))
        .isInstanceOf(JsonExtractionException.class);
  }
}
