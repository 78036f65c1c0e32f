package dev.regula.corpus;

import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Runs {@link IndexSnapshotBuilder} once when the application starts with the {@code build-index}
 * profile. That profile disables the web server and initializes beans lazily, so the serving
 * beans (and the snapshot loader) are never created during a build.
 */
@Component
@Profile("build-index")
public class SnapshotBuildRunner implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(SnapshotBuildRunner.class);

  private final IndexSnapshotBuilder builder;
  private final SnapshotProperties properties;

  public SnapshotBuildRunner(IndexSnapshotBuilder builder, SnapshotProperties properties) {
    this.builder = builder;
    this.properties = properties;
  }

  @Override
  public void run(ApplicationArguments args) {
    Path source = properties.source();
    if (source == null) {
      throw new IllegalStateException(
          "regula.snapshot.source must point to the ingestion chunk JSON when building the index");
    }
    log.info("Building index snapshot from {}", source);
    int count = builder.buildFromFile(source, properties.indexPath(), properties.chunksPath());
    log.info("Index snapshot ready ({} chunks)", count);
  }
}
