package dev.regula.llm;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the chat model shared by the reranker and the answer generator.
 *
 * <p>The model is built once at startup and injected wherever needed. LangChain4j's own retries
 * are disabled ({@code maxRetries(0)}) so that {@link LangChain4jTextGenerationClient} is the only
 * retry layer.
 */
@Configuration
public class LlmConfig {

  /**
   * Creates the OpenAI-compatible chat model.
   *
   * @param properties endpoint, credentials, model and timeout
   * @return the chat model
   * @throws IllegalStateException if no API key is configured
   */
  @Bean
  public ChatModel chatModel(LlmProperties properties) {
    if (properties.apiKey() == null || properties.apiKey().isBlank()) {
      throw new IllegalStateException(
          "LLM API key is required. Set regula.llm.api-key (REGULA_LLM_API_KEY).");
    }

    return OpenAiChatModel.builder()
        .baseUrl(properties.baseUrl())
        .apiKey(properties.apiKey())
        .modelName(properties.modelName())
        .temperature(properties.temperature())
        .timeout(Duration.ofMillis(properties.timeoutMs()))
        .maxRetries(0)
        .logRequests(false)
        .logResponses(false)
        .build();
  }
}
