package dev.regula.config;

import dev.regula.answer.GenerationException;
import dev.regula.guardrail.GuardrailViolationException;
import dev.regula.pipeline.PipelineTimeoutException;
import dev.regula.rerank.RerankException;
import dev.regula.search.RetrievalException;
import java.util.stream.Collectors;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global REST error handler that maps application exceptions to RFC 9457 Problem Detail responses.
 *
 * <ul>
 *   <li>guardrail violations and invalid arguments: 400
 *   <li>missing or malformed request body: 422
 *   <li>retrieval, reranking and generation failures: 500, with a generic detail
 *   <li>latency budget exceeded: 504
 * </ul>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  @ExceptionHandler(GuardrailViolationException.class)
  ProblemDetail handleGuardrailViolation(GuardrailViolationException ex) {
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.reason());
    problem.setTitle("Guardrail violation");
    return problem;
  }

  /**
   * Maps {@link IllegalArgumentException} to a 400 Bad Request Problem Detail.
   *
   * @param ex the exception thrown by validation logic
   * @return a Problem Detail with HTTP 400 status and the exception message
   */
  @ExceptionHandler(IllegalArgumentException.class)
  ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  ProblemDetail handleInvalidBody(MethodArgumentNotValidException ex) {
    String detail =
        ex.getBindingResult().getFieldErrors().stream()
            .map(e -> e.getField() + " " + e.getDefaultMessage())
            .collect(Collectors.joining(", "));
    return ProblemDetail.forStatusAndDetail(HttpStatus.UNPROCESSABLE_ENTITY, detail);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  ProblemDetail handleUnreadableBody(HttpMessageNotReadableException ex) {
    return ProblemDetail.forStatusAndDetail(
        HttpStatus.UNPROCESSABLE_ENTITY, "Request body is missing or not valid JSON");
  }

  @ExceptionHandler({
    RetrievalException.class,
    RerankException.class,
    GenerationException.class
  })
  ProblemDetail handleServiceFailure(RuntimeException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(
            HttpStatus.INTERNAL_SERVER_ERROR, "The answer could not be produced");
    problem.setProperty("category", category(ex));
    return problem;
  }

  @ExceptionHandler(PipelineTimeoutException.class)
  ProblemDetail handleTimeout(PipelineTimeoutException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.GATEWAY_TIMEOUT, ex.getMessage());
  }

  private static String category(RuntimeException ex) {
    if (ex instanceof RetrievalException) {
      return "retrieval";
    }
    if (ex instanceof RerankException) {
      return "rerank";
    }
    return "generation";
  }
}
