package dev.regula.search;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for hybrid retrieval, bound from {@code regula.retrieval.*}.
 *
 * <ul>
 *   <li>{@code candidate-k} - candidates fetched from each index and kept after fusion (default
 *       30, bounded [1, 200])
 *   <li>{@code top-k} - candidates kept after reranking (default 5, bounded [1, candidate-k])
 *   <li>{@code semantic-weight} / {@code lexical-weight} - reciprocal-rank weights (0.6 / 0.4);
 *       the semantic weight must be the larger one
 *   <li>{@code rank-constant} - reciprocal-rank damping constant (default 60)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "regula.retrieval")
public class RetrievalProperties {

  private int candidateK = 30;
  private int topK = 5;
  private double semanticWeight = 0.6;
  private double lexicalWeight = 0.4;
  private int rankConstant = 60;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (candidateK < 1 || candidateK > 200) {
      throw new IllegalStateException(
          "regula.retrieval.candidate-k must be in [1, 200], got: " + candidateK);
    }
    if (topK < 1 || topK > candidateK) {
      throw new IllegalStateException(
          "regula.retrieval.top-k must be in [1, candidate-k], got: " + topK);
    }
    if (lexicalWeight < 0.0 || semanticWeight <= lexicalWeight) {
      throw new IllegalStateException(
          "regula.retrieval.semantic-weight must exceed a non-negative lexical-weight, got: "
              + semanticWeight
              + " / "
              + lexicalWeight);
    }
    if (rankConstant < 0) {
      throw new IllegalStateException(
          "regula.retrieval.rank-constant must be >= 0, got: " + rankConstant);
    }
  }

  public int getCandidateK() {
    return candidateK;
  }

  public void setCandidateK(int candidateK) {
    this.candidateK = candidateK;
  }

  public int getTopK() {
    return topK;
  }

  public void setTopK(int topK) {
    this.topK = topK;
  }

  public double getSemanticWeight() {
    return semanticWeight;
  }

  public void setSemanticWeight(double semanticWeight) {
    this.semanticWeight = semanticWeight;
  }

  public double getLexicalWeight() {
    return lexicalWeight;
  }

  public void setLexicalWeight(double lexicalWeight) {
    this.lexicalWeight = lexicalWeight;
  }

  public int getRankConstant() {
    return rankConstant;
  }

  public void setRankConstant(int rankConstant) {
    this.rankConstant = rankConstant;
  }
}
