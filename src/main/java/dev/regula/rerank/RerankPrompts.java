package dev.regula.rerank;

import java.util.List;

/** Prompt text for the batched relevance-scoring call. */
final class RerankPrompts {

  static final String SYSTEM_PROMPT =
      """
      You are a relevance scoring model for Retrieval-Augmented Generation.

      Return ONLY valid JSON.
      No explanations. No extra text.

      JSON Schema:

      {
        "results": [
          {"id": number, "score": number between 0 and 1},
          ...
        ]
      }

      Rules:
      - Return exactly one result for every passage id.
      - Score reflects how well the passage answers the query.
      - Higher = more relevant.
      - Score ONLY based on semantic relevance.
      - Do not change passage IDs.
      - Do not include text from passages.
      """;

  private RerankPrompts() {}

  static String userPrompt(String query, List<String> passages, int maxPassageChars) {
    StringBuilder block = new StringBuilder();
    for (int i = 0; i < passages.size(); i++) {
      if (i > 0) {
        block.append("\n\n");
      }
      String text = passages.get(i);
      block
          .append("## Passage ")
          .append(i)
          .append('\n')
          .append(text.length() > maxPassageChars ? text.substring(0, maxPassageChars) : text);
    }
    return "Query:\n" + query + "\n\nPassages:\n" + block + "\n\nReturn JSON only.\n";
  }
}
