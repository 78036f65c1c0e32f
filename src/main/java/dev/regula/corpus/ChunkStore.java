package dev.regula.corpus;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only, in-memory collection of the chunks loaded from the persisted snapshot.
 *
 * <p>Built once at startup and never mutated afterwards, so concurrent requests can read it
 * without locking. Iteration order is the snapshot order, which is also the positional order of
 * the vectors in the semantic index.
 */
public final class ChunkStore {

  private final Map<String, Chunk> chunksById;
  private final List<Chunk> chunks;

  /**
   * Creates a store from the snapshot chunk list.
   *
   * @param chunks chunks in snapshot order
   * @throws IllegalStateException if two chunks share an id
   */
  public ChunkStore(List<Chunk> chunks) {
    Map<String, Chunk> byId = new LinkedHashMap<>();
    for (Chunk chunk : chunks) {
      if (byId.putIfAbsent(chunk.id(), chunk) != null) {
        throw new IllegalStateException("Duplicate chunk id in snapshot: " + chunk.id());
      }
    }
    this.chunksById = byId;
    this.chunks = List.copyOf(chunks);
  }

  public Optional<Chunk> get(String id) {
    return Optional.ofNullable(chunksById.get(id));
  }

  public List<Chunk> all() {
    return chunks;
  }

  public int size() {
    return chunks.size();
  }

  public boolean isEmpty() {
    return chunks.isEmpty();
  }
}
