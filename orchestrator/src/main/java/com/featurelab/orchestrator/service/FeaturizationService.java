package com.featurelab.orchestrator.service;

import com.featurelab.orchestrator.feature.FeatureRegistry;
import com.featurelab.orchestrator.model.Dataset;
import com.featurelab.orchestrator.model.DatasetFile;
import com.featurelab.orchestrator.model.Featureset;
import com.featurelab.orchestrator.pipeline.FeaturesetStorage;
import com.featurelab.orchestrator.pipeline.FeaturizationPipeline;
import com.featurelab.orchestrator.pipeline.FeaturizationRequest;
import com.featurelab.orchestrator.pipeline.PipelineHandle;
import com.featurelab.orchestrator.repository.DatasetRepository;
import com.featurelab.orchestrator.repository.FeaturesetRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.server.ResponseStatusException;

import java.nio.file.Path;
import java.util.List;

/**
 * Entry point for new featureset computations.
 *
 * Submission, in order:
 *  1. Filter the requested features to the catalog; reject an empty result
 *  2. Load the dataset and check the caller owns it
 *  3. Generate the artifact path (the file does not exist yet)
 *  4. In one transaction: save a PENDING row, submit the task graph, and
 *     store the terminal task key on the row
 *  5. After commit, hand the pipeline to the watcher
 *
 * The caller gets the PENDING row back immediately; the outcome arrives
 * later as a notification.
 */
@Service
public class FeaturizationService {

    private static final Logger log = LoggerFactory.getLogger(FeaturizationService.class);

    static final String NO_FEATURES_MESSAGE = "At least one feature must be selected.";
    static final String NO_DATASET_MESSAGE  = "No such data set";

    private final DatasetRepository     datasetRepo;
    private final FeaturesetRepository  featuresetRepo;
    private final FeatureRegistry       catalog;
    private final FeaturesetStorage     storage;
    private final FeaturizationPipeline pipeline;
    private final FeaturizationWatcher  watcher;
    private final PipelineMetrics       metrics;
    private final TransactionTemplate   tx;

    public FeaturizationService(DatasetRepository datasetRepo,
                                FeaturesetRepository featuresetRepo,
                                FeatureRegistry catalog,
                                FeaturesetStorage storage,
                                FeaturizationPipeline pipeline,
                                FeaturizationWatcher watcher,
                                PipelineMetrics metrics,
                                PlatformTransactionManager txManager) {
        this.datasetRepo    = datasetRepo;
        this.featuresetRepo = featuresetRepo;
        this.catalog        = catalog;
        this.storage        = storage;
        this.pipeline       = pipeline;
        this.watcher        = watcher;
        this.metrics        = metrics;
        this.tx             = new TransactionTemplate(txManager);
    }

    /**
     * Create a featureset and start computing it.
     *
     * @param customFeatsCode   accepted for compatibility; custom feature
     *                          scripts are not executed
     * @param requestedFeatures feature names the client ticked; unknown names are dropped
     * @return the committed PENDING row, carrying its task id
     * @throws FeaturesetValidationException if no known feature was requested
     * @throws ResponseStatusException       404 if the dataset does not exist
     * @throws FeaturesetAccessException     if the dataset belongs to someone else
     */
    public Featureset submit(String featuresetName,
                             long datasetId,
                             String customFeatsCode,
                             List<String> requestedFeatures,
                             String username) {
        if (featuresetName == null || featuresetName.isBlank()) {
            throw new FeaturesetValidationException("A featureset name is required.");
        }
        List<String> features = catalog.filterKnown(requestedFeatures);
        if (features.isEmpty()) {
            throw new FeaturesetValidationException(NO_FEATURES_MESSAGE);
        }

        Dataset dataset = datasetRepo.findWithFilesById(datasetId)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Dataset not found: " + datasetId));
        if (!dataset.isOwnedBy(username)) {
            throw new FeaturesetAccessException(NO_DATASET_MESSAGE);
        }

        if (customFeatsCode != null && !customFeatsCode.trim().isEmpty()) {
            log.info("Ignoring custom feature code for featureset '{}': custom scripts are not executed",
                    featuresetName);
        }

        List<String> fileUris = dataset.getFiles().stream().map(DatasetFile::getUri).toList();
        Path artifact = storage.newArtifactPath();
        FeaturizationRequest request = new FeaturizationRequest(fileUris, features, null, artifact);

        // Holder for the handle so it can leave the transaction callback.
        PipelineHandle[] submitted = new PipelineHandle[1];
        Featureset featureset;
        try {
            featureset = tx.execute(status -> {
                Featureset created = featuresetRepo.save(
                        new Featureset(featuresetName, artifact.toString(), dataset.getProject(), features));
                PipelineHandle handle = pipeline.submit(request);
                created.assignTask(handle.taskId());
                submitted[0] = handle;
                return featuresetRepo.save(created);
            });
        } catch (RuntimeException e) {
            if (submitted[0] != null) {
                discardUntracked(submitted[0], artifact);
            }
            throw e;
        }

        metrics.recordSubmitted();
        watcher.watch(submitted[0], featureset.getId(), username, featureset.getName());
        log.info("Featureset {} ('{}') submitted by '{}' on dataset {}: task={}, features={}",
                featureset.getId(), featureset.getName(), username, datasetId,
                featureset.getTaskId(), features);
        return featureset;
    }

    /**
     * The graph was queued but its row never committed. Tasks cannot be
     * cancelled, so wait for the pipeline to settle and drop whatever it wrote.
     */
    private void discardUntracked(PipelineHandle handle, Path artifact) {
        log.warn("Commit failed after task {} was queued; its artifact {} will be removed when it settles",
                handle.taskId(), artifact);
        handle.result().whenComplete((path, error) -> storage.deleteQuietly(artifact.toString()));
    }
}
