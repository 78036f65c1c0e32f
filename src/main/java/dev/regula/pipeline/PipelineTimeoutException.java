package dev.regula.pipeline;

/** A request exceeded {@code regula.pipeline.latency-budget-ms} and was abandoned between stages. */
public class PipelineTimeoutException extends RuntimeException {

  private final PipelineStage stage;

  public PipelineTimeoutException(PipelineStage stage, long elapsedMs, long budgetMs) {
    super(
        "Latency budget of "
            + budgetMs
            + " ms exceeded after "
            + elapsedMs
            + " ms, before stage "
            + stage);
    this.stage = stage;
  }

  /** The stage that was not started. */
  public PipelineStage stage() {
    return stage;
  }
}
