package dev.regula.api;

import dev.regula.corpus.ChunkStore;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Liveness endpoint reporting whether the index snapshot is loaded. */
@RestController
public class HealthController {

  private final ChunkStore chunkStore;

  public HealthController(ChunkStore chunkStore) {
    this.chunkStore = chunkStore;
  }

  @GetMapping("/health")
  public HealthResponse health() {
    return new HealthResponse("healthy", !chunkStore.isEmpty(), chunkStore.size());
  }
}
