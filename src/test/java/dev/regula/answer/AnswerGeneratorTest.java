package dev.regula.answer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.regula.llm.CompletionRequest;
import dev.regula.llm.LenientJsonParser;
import dev.regula.llm.LlmProperties;
import dev.regula.llm.TextGenerationClient;
import dev.regula.llm.TextGenerationException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AnswerGeneratorTest {

  private static final String QUERY = "What are the requirements for fire doors?";
  private static final String CONTEXT =
      "[Page 5]\nFire doors must be self-closing and fitted with intumescent seals.";
  private static final List<String> PAGES = List.of("/media/page_5.png");
  private static final List<String> MEDIA = List.of("Diagram 3.2");

  @Mock TextGenerationClient textGenerationClient;

  @Captor ArgumentCaptor<CompletionRequest> requestCaptor;

  private AnswerGenerator generator;

  @BeforeEach
  void setUp() {
    AnswerProperties answerProperties = AnswerProperties.defaults();
    generator =
        new AnswerGenerator(
            textGenerationClient,
            new LenientJsonParser(new ObjectMapper()),
            new KeywordHallucinationDetector(answerProperties),
            new AnswerSchema(answerProperties),
            new LlmProperties(
                "http://localhost",
                "key",
                "model",
                0.0,
                1000,
                new LlmProperties.Retry(1, 1, 1.0, 1)));
  }

  private void modelReplies(String raw) {
    given(textGenerationClient.complete(any(CompletionRequest.class))).willReturn(raw);
  }

  private static String answerJson(String summary, String links, String images) {
    return """
        {
          "mode": "answer",
          "answer": {
            "title": "Fire door requirements",
            "summary": "%s",
            "steps": ["Fit a self-closing device", "Install intumescent seals"],
            "verification": ["Page 5 lists both requirements"]
          },
          "links": %s,
          "media": {"images": %s}
        }
        """
        .formatted(summary, links, images);
  }

  @Test
  void returnsValidatedAnswer() {
    modelReplies(
        answerJson(
            "Fire doors must be self-closing and sealed.",
            "[\"/media/page_5.png\"]",
            "[\"Diagram 3.2\"]"));

    AnswerResponse response = generator.generate(QUERY, CONTEXT, PAGES, MEDIA);

    assertThat(response.mode()).isEqualTo("answer");
    assertThat(response.answer().title()).isEqualTo("Fire door requirements");
    assertThat(response.answer().steps()).hasSize(2);
    assertThat(response.links()).containsExactly("/media/page_5.png");
    assertThat(response.images()).containsExactly("Diagram 3.2");
    assertThat(response.latencyMs()).isZero();
  }

  @Test
  void promptCarriesContextAndAllowedReferences() {
    modelReplies(answerJson("Fire doors must be self-closing.", "[]", "[]"));

    generator.generate(QUERY, CONTEXT, PAGES, MEDIA);

    verify(textGenerationClient).complete(requestCaptor.capture());
    CompletionRequest sent = requestCaptor.getValue();
    assertThat(sent.userPrompt())
        .contains("QUESTION:\n" + QUERY)
        .contains("CONTEXT:\n" + CONTEXT)
        .contains("PAGES:\n[\"/media/page_5.png\"]")
        .contains("MEDIA:\n[\"Diagram 3.2\"]");
    assertThat(sent.systemPrompt()).contains("Return ONLY valid JSON");
  }

  @Test
  void referencesOutsideTheAllowedSetsAreDropped() {
    modelReplies(
        answerJson(
            "Fire doors must be self-closing and sealed.",
            "[\"/media/page_5.png\", \"/media/page_999.png\", \"/media/page_5.png\"]",
            "[\"Diagram 9.9\", \"Diagram 3.2\"]"));

    AnswerResponse response = generator.generate(QUERY, CONTEXT, PAGES, MEDIA);

    assertThat(response.links()).containsExactly("/media/page_5.png");
    assertThat(response.images()).containsExactly("Diagram 3.2");
  }

  @Test
  void hedgedAnswerCollapsesToNoInformation() {
    modelReplies(
        answerJson(
            "This is based on common knowledge about doors.",
            "[\"/media/page_5.png\"]",
            "[]"));

    AnswerResponse response = generator.generate(QUERY, CONTEXT, PAGES, MEDIA);

    assertThat(response).isEqualTo(AnswerResponse.noInformation(0));
    assertThat(response.isNoInformation()).isTrue();
    assertThat(response.links()).isEmpty();
  }

  @Test
  void jsonWrappedInProseIsAccepted() {
    modelReplies(
        "Here is the answer:\n"
            + answerJson("Fire doors must be self-closing.", "[]", "[]")
            + "\nLet me know if you need more.");

    assertThat(generator.generate(QUERY, CONTEXT, PAGES, MEDIA).answer().summary())
        .isEqualTo("Fire doors must be self-closing.");
  }

  @Test
  void nonJsonOutputFails() {
    modelReplies("Fire doors must be self-closing.");

    assertThatThrownBy(() -> generator.generate(QUERY, CONTEXT, PAGES, MEDIA))
        .isInstanceOf(GenerationException.class)
        .hasMessageContaining("not valid JSON");
  }

  @Test
  void structurallyInvalidAnswerFails() {
    modelReplies(answerJson("Too short", "[]", "[]"));

    assertThatThrownBy(() -> generator.generate(QUERY, CONTEXT, PAGES, MEDIA))
        .isInstanceOf(GenerationException.class)
        .hasMessageContaining("Summary too short or empty");
  }

  @Test
  void missingLinksFieldFails() {
    modelReplies(
        "{\"mode\":\"answer\",\"answer\":{\"title\":\"Fire doors\","
            + "\"summary\":\"Fire doors must close.\",\"steps\":[],\"verification\":[]},"
            + "\"media\":{\"images\":[]}}");

    assertThatThrownBy(() -> generator.generate(QUERY, CONTEXT, PAGES, MEDIA))
        .isInstanceOf(GenerationException.class)
        .hasMessageContaining("Missing required field: links");
  }

  @Test
  void exhaustedRetriesFail() {
    given(textGenerationClient.complete(any(CompletionRequest.class)))
        .willThrow(new TextGenerationException("429 Too Many Requests"));

    assertThatThrownBy(() -> generator.generate(QUERY, CONTEXT, PAGES, MEDIA))
        .isInstanceOf(GenerationException.class)
        .hasMessageContaining("after retries")
        .hasCauseInstanceOf(TextGenerationException.class);
  }

  @Test
  void blankInputsAreRejectedBeforeAnyCall() {
    assertThatThrownBy(() -> generator.generate(" ", CONTEXT, PAGES, MEDIA))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> generator.generate(QUERY, "", PAGES, MEDIA))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(textGenerationClient);
  }
}
