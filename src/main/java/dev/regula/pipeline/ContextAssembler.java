package dev.regula.pipeline;

import dev.regula.corpus.Chunk;
import dev.regula.rerank.RankedChunk;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Joins the reranked chunks into the generator context and derives the allowed-reference sets.
 *
 * <p>Both sets come from the selected chunks only, never from the wider corpus; they are what
 * generated citations are checked against.
 */
@Component
public class ContextAssembler {

  private static final Logger log = LoggerFactory.getLogger(ContextAssembler.class);

  static final String SEPARATOR = "\n\n---\n\n";

  private final PipelineProperties properties;

  public ContextAssembler(PipelineProperties properties) {
    this.properties = properties;
  }

  /**
   * Assembles the context for the given chunks.
   *
   * @param ranked reranked chunks, best first
   * @return context text plus sorted, de-duplicated page and diagram references
   */
  public AssembledContext assemble(List<RankedChunk> ranked) {
    List<Chunk> chunks = ranked.stream().map(RankedChunk::chunk).toList();

    String text =
        chunks.stream()
            .map(c -> "[Page " + c.page() + "]\n" + c.text())
            .collect(Collectors.joining(SEPARATOR));

    TreeSet<String> pages = new TreeSet<>();
    TreeSet<String> diagrams = new TreeSet<>();
    for (Chunk chunk : chunks) {
      pages.addAll(chunk.media());
      diagrams.addAll(chunk.diagramIds());
    }

    List<String> allowedMedia = new ArrayList<>(diagrams);
    if (allowedMedia.size() > properties.maxContextDiagrams()) {
      log.warn(
          "Selected chunks reference {} diagrams, keeping the first {}",
          allowedMedia.size(),
          properties.maxContextDiagrams());
      allowedMedia = allowedMedia.subList(0, properties.maxContextDiagrams());
    }

    return new AssembledContext(text, new ArrayList<>(pages), allowedMedia, chunks);
  }
}
