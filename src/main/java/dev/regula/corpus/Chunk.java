package dev.regula.corpus;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.LinkedHashSet;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A unit of retrievable text extracted from the source corpus during ingestion.
 *
 * <p>Chunks are immutable and owned by the {@link ChunkStore} for the lifetime of the process.
 * {@code diagramIds} and {@code media} are ordered sets: duplicates are dropped on construction
 * while first-seen order is kept.
 *
 * @param id unique chunk identifier, also the embedding id in the vector index
 * @param page 1-based page number in the source document
 * @param text the chunk text
 * @param tokenCount token count computed at ingestion time
 * @param diagramIds diagram labels embedded in the text (e.g. {@code "Diagram 2.3"})
 * @param media page-level media paths (e.g. {@code "/media/page_5.png"})
 * @param table whether the chunk was extracted from a table
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Chunk(
    @NotBlank String id,
    @Positive int page,
    @NotBlank String text,
    @PositiveOrZero @JsonProperty("token_count") int tokenCount,
    @JsonProperty("diagram_ids") List<String> diagramIds,
    List<String> media,
    @JsonProperty("is_table") boolean table) {

  public Chunk {
    diagramIds = orderedSet(diagramIds);
    media = orderedSet(media);
  }

  private static List<String> orderedSet(@Nullable List<String> values) {
    if (values == null || values.isEmpty()) {
      return List.of();
    }
    return List.copyOf(new LinkedHashSet<>(values));
  }
}
