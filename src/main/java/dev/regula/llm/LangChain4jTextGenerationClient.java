package dev.regula.llm;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.RetryContext;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.retry.support.RetrySynchronizationManager;
import org.springframework.stereotype.Service;

/**
 * {@link TextGenerationClient} backed by a LangChain4j {@link ChatModel}.
 *
 * <p>The timeout lives on the model (see {@link LlmConfig}). Every provider failure, including a
 * blank completion, becomes a {@link TextGenerationException} and is retried with exponential
 * backoff up to {@code regula.llm.retry.max-attempts} attempts in total; the last exception is
 * rethrown once attempts are exhausted.
 */
@Service
public class LangChain4jTextGenerationClient implements TextGenerationClient {

  private static final Logger log = LoggerFactory.getLogger(LangChain4jTextGenerationClient.class);

  private final ChatModel chatModel;

  public LangChain4jTextGenerationClient(ChatModel chatModel) {
    this.chatModel = chatModel;
  }

  @Override
  @Retryable(
      retryFor = TextGenerationException.class,
      maxAttemptsExpression = "${regula.llm.retry.max-attempts}",
      backoff =
          @Backoff(
              delayExpression = "${regula.llm.retry.delay-ms}",
              multiplierExpression = "${regula.llm.retry.multiplier}",
              maxDelayExpression = "${regula.llm.retry.max-delay-ms}"))
  public String complete(CompletionRequest request) {
    RetryContext retryContext = RetrySynchronizationManager.getContext();
    if (retryContext != null && retryContext.getRetryCount() > 0) {
      log.warn(
          "Retrying text generation (attempt {}): {}",
          retryContext.getRetryCount() + 1,
          retryContext.getLastThrowable() != null
              ? retryContext.getLastThrowable().getMessage()
              : "unknown cause");
    }

    ChatRequest chatRequest =
        ChatRequest.builder()
            .messages(
                SystemMessage.from(request.systemPrompt()), UserMessage.from(request.userPrompt()))
            .temperature(request.temperature())
            .build();

    ChatResponse response;
    try {
      response = chatModel.chat(chatRequest);
    } catch (RuntimeException e) {
      throw new TextGenerationException("Text generation call failed: " + e.getMessage(), e);
    }

    AiMessage message = response == null ? null : response.aiMessage();
    String text = message == null ? null : message.text();
    if (text == null || text.isBlank()) {
      throw new TextGenerationException("Text generation returned an empty completion");
    }
    log.debug("Completion received: {} chars", text.length());
    return text;
  }
}
