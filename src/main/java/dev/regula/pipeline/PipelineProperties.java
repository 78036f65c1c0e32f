package dev.regula.pipeline;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Orchestration settings, bound from {@code regula.pipeline.*}.
 *
 * @param latencyBudgetMs overall per-request budget, checked between stages
 * @param maxContextDiagrams cap on the diagram references offered to the generator
 */
@ConfigurationProperties(prefix = "regula.pipeline")
public record PipelineProperties(
    @DefaultValue("60000") long latencyBudgetMs, @DefaultValue("25") int maxContextDiagrams) {

  public PipelineProperties {
    if (latencyBudgetMs <= 0) {
      throw new IllegalStateException(
          "regula.pipeline.latency-budget-ms must be positive, got: " + latencyBudgetMs);
    }
    if (maxContextDiagrams < 0) {
      throw new IllegalStateException(
          "regula.pipeline.max-context-diagrams must be >= 0, got: " + maxContextDiagrams);
    }
  }
}
