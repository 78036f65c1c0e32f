package dev.regula.llm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LangChain4jTextGenerationClientTest {

  @Mock ChatModel chatModel;

  @InjectMocks LangChain4jTextGenerationClient client;

  @Captor ArgumentCaptor<ChatRequest> requestCaptor;

  private static final CompletionRequest REQUEST =
      new CompletionRequest("system rules", "user question", 0.0);

  private static ChatResponse response(String text) {
    return ChatResponse.builder().aiMessage(AiMessage.from(text)).build();
  }

  @Test
  void sendsSystemAndUserMessagesAtRequestedTemperature() {
    given(chatModel.chat(any(ChatRequest.class))).willReturn(response("{\"ok\":true}"));

    String text = client.complete(REQUEST);

    assertThat(text).isEqualTo("{\"ok\":true}");
    verify(chatModel).chat(requestCaptor.capture());
    ChatRequest sent = requestCaptor.getValue();
    assertThat(sent.messages()).hasSize(2);
    assertThat(sent.messages().get(0)).isEqualTo(SystemMessage.from("system rules"));
    assertThat(sent.messages().get(1)).isEqualTo(UserMessage.from("user question"));
    assertThat(sent.parameters().temperature()).isEqualTo(0.0);
  }

  @Test
  void providerFailureBecomesTextGenerationException() {
    given(chatModel.chat(any(ChatRequest.class))).willThrow(new RuntimeException("timeout"));

    assertThatThrownBy(() -> client.complete(REQUEST))
        .isInstanceOf(TextGenerationException.class)
        .hasMessageContaining("timeout")
        .hasCauseInstanceOf(RuntimeException.class);
  }

  @Test
  void blankCompletionIsTextGenerationException() {
    given(chatModel.chat(any(ChatRequest.class))).willReturn(response("   "));

    assertThatThrownBy(() -> client.complete(REQUEST))
        .isInstanceOf(TextGenerationException.class)
        .hasMessageContaining("empty");
  }

  @Test
  void completionRequestRejectsBlankPrompts() {
    assertThatThrownBy(() -> new CompletionRequest(" ", "user", 0.0))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new CompletionRequest("system", "", 0.0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
