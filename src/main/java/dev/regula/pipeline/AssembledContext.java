package dev.regula.pipeline;

import dev.regula.corpus.Chunk;
import java.util.List;

/**
 * Generator input built from the reranked chunks of one request.
 *
 * @param text chunk texts with page markers, in reranked order
 * @param allowedPages page media paths of the selected chunks; the only links an answer may cite
 * @param allowedMedia diagram ids of the selected chunks; the only images an answer may cite
 * @param chunks the selected chunks
 */
public record AssembledContext(
    String text, List<String> allowedPages, List<String> allowedMedia, List<Chunk> chunks) {

  public AssembledContext {
    allowedPages = List.copyOf(allowedPages);
    allowedMedia = List.copyOf(allowedMedia);
    chunks = List.copyOf(chunks);
  }
}
