package dev.regula.pipeline;

/** Stages of one question-answering request, in execution order. */
public enum PipelineStage {
  INPUT_VALIDATION,
  RETRIEVAL,
  RERANK,
  CONTEXT_ASSEMBLY,
  CONTEXT_VALIDATION,
  GENERATION,
  OUTPUT_VALIDATION
}
