package com.featurelab.orchestrator.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Location and format of persisted featureset artifacts.
 *
 * Artifacts are JSON documents:
 * <pre>
 *   {"features": [...], "names": [...], "values": [[...], ...], "labels": [...]}
 * </pre>
 * written under {@code featurelab.paths.features-folder}.
 */
@Component
public class FeaturesetStorage {

    private static final Logger log = LoggerFactory.getLogger(FeaturesetStorage.class);

    private final Path         featuresFolder;
    private final ObjectMapper json;

    public FeaturesetStorage(@Value("${featurelab.paths.features-folder}") String featuresFolder,
                             ObjectMapper objectMapper) {
        this.featuresFolder = Path.of(featuresFolder);
        this.json           = objectMapper;
    }

    /**
     * A fresh artifact path, generated before the computation runs so it can
     * be recorded right away. The file does not exist yet.
     */
    public Path newArtifactPath() {
        return featuresFolder.resolve(UUID.randomUUID() + "_featureset.json");
    }

    /**
     * Write the artifact to {@code target}, creating parent directories.
     *
     * @param labels one label per row (entries may be null)
     * @return {@code target}
     * @throws PipelineException if the file cannot be written
     */
    public Path write(FeatureTable table, List<String> labels, Path target) {
        if (labels.size() != table.rowCount()) {
            throw new PipelineException(labels.size() + " labels for " + table.rowCount() + " rows");
        }
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("features", table.features());
        document.put("names",    table.seriesNames());
        document.put("values",   table.values());
        document.put("labels",   new ArrayList<>(labels));
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            json.writeValue(target.toFile(), document);
            log.info("Wrote featureset artifact {} ({} rows, {} features)",
                    target, table.rowCount(), table.features().size());
            return target;
        } catch (IOException e) {
            throw new PipelineException("Could not write featureset artifact " + target, e);
        }
    }

    /**
     * Remove an artifact if present.
     * Failures are logged, not thrown: the database row is already gone and
     * a leftover file only costs disk space.
     */
    public void deleteQuietly(String fileUri) {
        if (fileUri == null || fileUri.isBlank()) return;
        try {
            if (Files.deleteIfExists(TimeSeriesLoader.resolve(fileUri))) {
                log.info("Deleted featureset artifact {}", fileUri);
            }
        } catch (IOException | RuntimeException e) {
            log.warn("Could not delete featureset artifact {}, manual cleanup may be needed: {}",
                    fileUri, e.getMessage());
        }
    }
}
