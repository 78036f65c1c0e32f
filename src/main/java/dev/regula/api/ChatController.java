package dev.regula.api;

import dev.regula.answer.AnswerResponse;
import dev.regula.pipeline.RagPipeline;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Question-answering endpoint. Errors are mapped to Problem Details by {@link
 * dev.regula.config.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/chat")
public class ChatController {

  private final RagPipeline ragPipeline;

  public ChatController(RagPipeline ragPipeline) {
    this.ragPipeline = ragPipeline;
  }

  @PostMapping("/answer")
  public AnswerResponse answer(@Valid @RequestBody QuestionRequest request) {
    return ragPipeline.answer(request.question());
  }
}
