package dev.regula.corpus;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Loads the persisted index snapshot at startup.
 *
 * <p>Both artifacts must be present and readable. A missing or corrupt artifact, a chunk that
 * fails validation, or duplicate chunk ids are configuration errors: {@link #load()} throws {@link
 * IllegalStateException} and the application does not start.
 */
@Component
public class IndexSnapshotLoader {

  private static final Logger log = LoggerFactory.getLogger(IndexSnapshotLoader.class);

  private static final TypeReference<List<Chunk>> CHUNK_LIST = new TypeReference<>() {};

  private final SnapshotProperties properties;
  private final ObjectMapper objectMapper;
  private final Validator validator;

  public IndexSnapshotLoader(
      SnapshotProperties properties, ObjectMapper objectMapper, Validator validator) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.validator = validator;
  }

  /**
   * Reads the chunk records and the vector index.
   *
   * @return the loaded snapshot
   * @throws IllegalStateException if the snapshot is missing, incomplete or invalid
   */
  public IndexSnapshot load() {
    Path indexPath = properties.indexPath();
    Path chunksPath = properties.chunksPath();
    requireArtifact(indexPath, "vector index");
    requireArtifact(chunksPath, "chunk metadata");

    List<Chunk> chunks = readChunks(chunksPath);
    ChunkStore chunkStore = new ChunkStore(chunks);

    InMemoryEmbeddingStore<TextSegment> embeddingStore;
    try {
      embeddingStore = InMemoryEmbeddingStore.fromFile(indexPath);
    } catch (RuntimeException e) {
      throw new IllegalStateException("Unreadable vector index at " + indexPath, e);
    }
    requireSameIds(chunks, readVectorIds(indexPath), indexPath, chunksPath);

    log.info("Loaded index snapshot: {} chunks from {}, vectors from {}",
        chunkStore.size(), chunksPath, indexPath);
    return new IndexSnapshot(chunkStore, embeddingStore);
  }

  List<Chunk> readChunks(Path chunksPath) {
    List<Chunk> chunks;
    try {
      chunks = objectMapper.readValue(chunksPath.toFile(), CHUNK_LIST);
    } catch (IOException e) {
      throw new IllegalStateException("Unreadable chunk metadata at " + chunksPath, e);
    }
    if (chunks == null || chunks.isEmpty()) {
      throw new IllegalStateException("Chunk metadata at " + chunksPath + " contains no chunks");
    }

    List<String> problems = new ArrayList<>();
    for (int i = 0; i < chunks.size(); i++) {
      Set<ConstraintViolation<Chunk>> violations = validator.validate(chunks.get(i));
      if (!violations.isEmpty()) {
        int position = i;
        problems.add(violations.stream()
            .map(v -> "chunk[" + position + "]." + v.getPropertyPath() + ": " + v.getMessage())
            .collect(Collectors.joining(", ")));
      }
    }
    if (!problems.isEmpty()) {
      throw new IllegalStateException(
          "Invalid chunk metadata at " + chunksPath + ": " + String.join("; ", problems));
    }
    return chunks;
  }

  Set<String> readVectorIds(Path indexPath) {
    JsonNode entries;
    try {
      entries = objectMapper.readTree(indexPath.toFile()).path("entries");
    } catch (IOException e) {
      throw new IllegalStateException("Unreadable vector index at " + indexPath, e);
    }
    Set<String> ids = new LinkedHashSet<>();
    for (JsonNode entry : entries) {
      ids.add(entry.path("id").asText());
    }
    return ids;
  }

  private static void requireSameIds(
      List<Chunk> chunks, Set<String> vectorIds, Path indexPath, Path chunksPath) {
    Set<String> chunkIds = new LinkedHashSet<>();
    chunks.forEach(chunk -> chunkIds.add(chunk.id()));

    Set<String> withoutVector = new LinkedHashSet<>(chunkIds);
    withoutVector.removeAll(vectorIds);
    Set<String> withoutChunk = new LinkedHashSet<>(vectorIds);
    withoutChunk.removeAll(chunkIds);
    if (!withoutVector.isEmpty() || !withoutChunk.isEmpty()) {
      throw new IllegalStateException(
          "Vector index at " + indexPath + " and chunk metadata at " + chunksPath
              + " disagree: chunks without vectors " + withoutVector
              + ", vectors without chunks " + withoutChunk
              + ". Rebuild the snapshot with the 'build-index' profile.");
    }
  }

  private static void requireArtifact(Path path, String description) {
    if (path == null || !Files.isRegularFile(path)) {
      throw new IllegalStateException(
          "Index snapshot incomplete: " + description + " not found at " + path
              + ". Build the snapshot with the 'build-index' profile first.");
    }
  }
}
