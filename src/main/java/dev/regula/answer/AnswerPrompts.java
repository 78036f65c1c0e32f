package dev.regula.answer;

import java.util.List;
import java.util.stream.Collectors;

/** Prompt text for structured answer generation. */
final class AnswerPrompts {

  static final String SYSTEM_PROMPT =
      """
      You are an expert RAG answering assistant.

      Return ONLY valid JSON matching this exact schema:

      {
        "mode": "answer",
        "answer": {
          "title": "string",
          "summary": "string",
          "steps": ["string", ...],
          "verification": ["string", ...]
        },
        "links": ["string", ...],
        "media": {
          "images": ["string", ...]
        }
      }

      CRITICAL RULES:
      - Output JSON only, with no extra text.
      - All fields must be present.
      - "links" must contain ONLY pages from the provided PAGES list.
      - "media.images" must contain ONLY diagrams from the provided MEDIA list.
      - Do NOT invent or hallucinate page numbers or media files.
      - Use ONLY the exact page and media references provided in the PAGES and MEDIA sections.
      - "steps" must be actionable.
      - "verification" must reference how the pages support the answer.
      - Use ONLY the provided context. No hallucinations.
      - If the context does not contain information to answer the question, you MUST return
        title: "No Information Found", summary: "No relevant information was found in the \
      documentation.", steps: [], verification: [], links: [], and media.images: []
      - NEVER use general knowledge or information from outside the provided CONTEXT.
      """;

  private AnswerPrompts() {}

  static String userPrompt(
      String query, String context, List<String> allowedPages, List<String> allowedMedia) {
    return "QUESTION:\n"
        + query
        + "\n\nCONTEXT:\n"
        + context
        + "\n\nPAGES:\n"
        + quotedList(allowedPages)
        + "\n\nMEDIA:\n"
        + quotedList(allowedMedia)
        + "\n";
  }

  private static String quotedList(List<String> items) {
    return items.stream().map(i -> "\"" + i + "\"").collect(Collectors.joining(", ", "[", "]"));
  }
}
