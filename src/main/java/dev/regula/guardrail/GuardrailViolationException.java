package dev.regula.guardrail;

/** A query, context or answer failed a guardrail check. The message is safe to show to callers. */
public class GuardrailViolationException extends RuntimeException {

  public GuardrailViolationException(String reason) {
    super(reason);
  }

  public String reason() {
    return getMessage();
  }
}
