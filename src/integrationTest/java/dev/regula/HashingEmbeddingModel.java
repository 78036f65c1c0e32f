package dev.regula;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import dev.regula.search.Tokenizer;
import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic bag-of-words embedding for integration tests: each token increments one hashed
 * dimension, and dimension 0 is a constant bias so every pair of vectors has positive similarity.
 */
public class HashingEmbeddingModel implements EmbeddingModel {

  static final int DIMENSION = 64;

  @Override
  public Response<List<Embedding>> embedAll(List<TextSegment> segments) {
    List<Embedding> embeddings = new ArrayList<>(segments.size());
    for (TextSegment segment : segments) {
      float[] vector = new float[DIMENSION];
      vector[0] = 1f;
      for (String token : Tokenizer.tokenize(segment.text())) {
        vector[1 + Math.floorMod(token.hashCode(), DIMENSION - 1)] += 1f;
      }
      embeddings.add(Embedding.from(vector));
    }
    return Response.from(embeddings);
  }

  @Override
  public int dimension() {
    return DIMENSION;
  }
}
