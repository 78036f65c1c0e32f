package dev.regula.answer;

import java.util.Optional;

/**
 * Decides whether a generated answer reached outside the supplied context. When it did, the
 * generator replaces the whole answer with {@link AnswerResponse#noInformation}.
 */
public interface HallucinationDetector {

  /**
   * Inspects the answer.
   *
   * @param answer the parsed answer content
   * @param context the context the answer was generated from
   * @return a short reason if the answer is judged ungrounded, empty otherwise
   */
  Optional<String> detect(AnswerContent answer, String context);
}
