package dev.regula.corpus;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Offline batch step that embeds chunk texts and writes both snapshot artifacts.
 *
 * <p>Validation is all-or-nothing: if any chunk fails validation, nothing is embedded or written.
 * Embeddings are computed in batches <em>before</em> any file is touched, so a failing batch
 * leaves an existing snapshot intact. Both artifacts are written to temporary siblings and then
 * moved into place together.
 *
 * <p>Must not run while a server is reading the same snapshot location.
 */
@Service
public class IndexSnapshotBuilder {

    private static final Logger log = LoggerFactory.getLogger(IndexSnapshotBuilder.class);

    private static final TypeReference<List<Chunk>> CHUNK_LIST = new TypeReference<>() {};

    private final EmbeddingModel embeddingModel;
    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final EmbeddingProperties embeddingProperties;

    public IndexSnapshotBuilder(EmbeddingModel embeddingModel,
                                ObjectMapper objectMapper,
                                Validator validator,
                                EmbeddingProperties embeddingProperties) {
        this.embeddingModel = embeddingModel;
        this.objectMapper = objectMapper;
        this.validator = validator;
        this.embeddingProperties = embeddingProperties;
    }

    /**
     * Reads ingestion output and builds a snapshot at the given locations.
     *
     * @param source     chunk JSON array produced by ingestion
     * @param indexPath  destination of the serialized vector index
     * @param chunksPath destination of the chunk records
     * @return the number of chunks written
     */
    public int buildFromFile(Path source, Path indexPath, Path chunksPath) {
        List<Chunk> chunks;
        try {
            chunks = objectMapper.readValue(source.toFile(), CHUNK_LIST);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read ingestion output " + source, e);
        }
        return build(chunks, indexPath, chunksPath);
    }

    /**
     * Embeds the chunks and writes the vector index and chunk records.
     *
     * @return the number of chunks written
     * @throws IllegalArgumentException if any chunk fails validation or ids are not unique
     */
    public int build(List<Chunk> chunks, Path indexPath, Path chunksPath) {
        // 1. Validate everything up front
        validate(chunks);

        // 2. Chunk -> TextSegment, keyed by chunk id
        List<String> ids = chunks.stream().map(Chunk::id).toList();
        List<TextSegment> segments = chunks.stream().map(IndexSnapshotBuilder::toSegment).toList();

        // 3. Compute ALL embeddings before touching the filesystem
        List<Embedding> embeddings = embedAll(segments);

        InMemoryEmbeddingStore<TextSegment> store = new InMemoryEmbeddingStore<>();
        store.addAll(ids, embeddings, segments);

        // 4. Write both artifacts side by side, then move them into place
        try {
            createParent(indexPath);
            createParent(chunksPath);
            Path indexTmp = indexPath.resolveSibling(indexPath.getFileName() + ".tmp");
            Path chunksTmp = chunksPath.resolveSibling(chunksPath.getFileName() + ".tmp");
            store.serializeToFile(indexTmp);
            objectMapper.writeValue(chunksTmp.toFile(), chunks);
            Files.move(indexTmp, indexPath, StandardCopyOption.REPLACE_EXISTING);
            Files.move(chunksTmp, chunksPath, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write index snapshot", e);
        }

        log.info("Built index snapshot: {} chunks -> {}, {}", chunks.size(), indexPath, chunksPath);
        return chunks.size();
    }

    private void validate(List<Chunk> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            throw new IllegalArgumentException("No chunks to index");
        }
        List<String> messages = new ArrayList<>();
        for (Chunk chunk : chunks) {
            Set<ConstraintViolation<Chunk>> violations = validator.validate(chunk);
            violations.forEach(v -> messages.add(chunk.id() + "." + v.getPropertyPath() + ": " + v.getMessage()));
        }
        long distinctIds = chunks.stream().map(Chunk::id).distinct().count();
        if (distinctIds != chunks.size()) {
            messages.add("chunk ids must be unique");
        }
        if (!messages.isEmpty()) {
            throw new IllegalArgumentException("Validation failed: " + String.join(", ", messages));
        }
    }

    private List<Embedding> embedAll(List<TextSegment> segments) {
        int batchSize = embeddingProperties.batchSize();
        List<Embedding> all = new ArrayList<>(segments.size());
        for (int i = 0; i < segments.size(); i += batchSize) {
            List<TextSegment> batch = segments.subList(i, Math.min(i + batchSize, segments.size()));
            List<Embedding> embedded = embeddingModel.embedAll(batch).content();
            if (embedded.size() != batch.size()) {
                throw new IllegalStateException("Embedding batch returned " + embedded.size()
                        + " vectors for " + batch.size() + " texts");
            }
            all.addAll(embedded);
        }
        return all;
    }

    private static TextSegment toSegment(Chunk chunk) {
        return TextSegment.from(chunk.text(), Metadata.from("chunk_id", chunk.id())
                .put("page", chunk.page()));
    }

    private static void createParent(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
