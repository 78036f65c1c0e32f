package dev.regula.pipeline;

import dev.regula.corpus.Chunk;
import dev.regula.search.Tokenizer;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Cheap lexical check that the retrieved passages have anything to do with the question: true when
 * the two share at least one non-stopword token. Only passage text counts, never the page markers
 * the assembler adds.
 */
@Component
public class RelevanceGate {

  public boolean isRelevant(String query, List<Chunk> chunks) {
    List<String> texts = chunks.stream().map(Chunk::text).toList();
    return isRelevant(query, String.join("\n\n", texts));
  }

  public boolean isRelevant(String query, String context) {
    Set<String> queryTerms = new HashSet<>(Tokenizer.tokenize(query));
    if (queryTerms.isEmpty()) {
      return false;
    }
    for (String term : Tokenizer.tokenize(context)) {
      if (queryTerms.contains(term)) {
        return true;
      }
    }
    return false;
  }
}
