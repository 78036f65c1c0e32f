package dev.regula.corpus;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingStore;

/**
 * The pair of artifacts loaded together at startup: the chunk records and the nearest-neighbour
 * index over their embeddings. Embedding ids in the store are chunk ids.
 *
 * @param chunkStore the chunk records
 * @param embeddingStore the vector index
 */
public record IndexSnapshot(ChunkStore chunkStore, EmbeddingStore<TextSegment> embeddingStore) {}
