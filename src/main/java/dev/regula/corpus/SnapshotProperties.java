package dev.regula.corpus;

import java.nio.file.Path;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Locations of the persisted index snapshot, bound from {@code regula.snapshot.*}.
 *
 * @param indexPath serialized vector index (LangChain4j in-memory store JSON)
 * @param chunksPath chunk records JSON, keyed to the vectors by chunk id
 * @param source chunk JSON produced by ingestion; only read by the {@code build-index} profile
 */
@ConfigurationProperties(prefix = "regula.snapshot")
public record SnapshotProperties(Path indexPath, Path chunksPath, @Nullable Path source) {}
