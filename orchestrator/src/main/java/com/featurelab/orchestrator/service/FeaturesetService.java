package com.featurelab.orchestrator.service;

import com.featurelab.orchestrator.model.Featureset;
import com.featurelab.orchestrator.pipeline.FeaturesetStorage;
import com.featurelab.orchestrator.repository.FeaturesetRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Lifecycle of featureset rows after creation.
 *
 * Every method runs in its own transaction and looks the row up by id, so
 * callers on other threads (the completion watcher) never reuse an entity
 * instance loaded in the request's persistence context.
 */
@Service
public class FeaturesetService {

    private static final Logger log = LoggerFactory.getLogger(FeaturesetService.class);

    private final FeaturesetRepository featuresetRepo;
    private final FeaturesetStorage    storage;
    private final FailurePolicy        failurePolicy;

    public FeaturesetService(FeaturesetRepository featuresetRepo,
                             FeaturesetStorage storage,
                             @Value("${featurelab.featurize.failure-policy:DELETE}") FailurePolicy failurePolicy) {
        this.featuresetRepo = featuresetRepo;
        this.storage        = storage;
        this.failurePolicy  = failurePolicy;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    /** All featuresets in projects owned by {@code username}, newest first. */
    @Transactional(readOnly = true)
    public List<Featureset> listVisible(String username) {
        return featuresetRepo.findByProjectOwnerOrderByCreatedAtDesc(username);
    }

    /**
     * @throws ResponseStatusException     404 if no such featureset
     * @throws FeaturesetAccessException   if it belongs to someone else
     */
    @Transactional(readOnly = true)
    public Featureset getOwned(UUID id, String username) {
        Featureset featureset = featuresetRepo.findById(id)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Featureset not found: " + id));
        if (!featureset.getProject().isOwnedBy(username)) {
            throw new FeaturesetAccessException("No such featureset");
        }
        return featureset;
    }

    // ------------------------------------------------------------------
    // Completion (called by FeaturizationWatcher on a callback thread)
    // ------------------------------------------------------------------

    /**
     * PENDING → COMPLETED: clear the task id and stamp the finish time.
     *
     * @return the updated row, or empty if it was deleted while the pipeline ran
     */
    @Transactional
    public Optional<Featureset> markCompleted(UUID id, Instant finishedAt) {
        Optional<Featureset> found = featuresetRepo.findById(id);
        found.ifPresent(featureset -> {
            featureset.markCompleted(finishedAt);
            featuresetRepo.save(featureset);
            log.info("Featureset {} ('{}') COMPLETED", id, featureset.getName());
        });
        return found;
    }

    /**
     * Resolve a featureset whose pipeline failed, according to the failure policy.
     * Under DELETE the row is removed; under MARK_FAILED it is kept as FAILED.
     *
     * @return the row as it was before deletion (DELETE) or after the update
     *         (MARK_FAILED); empty if it was already gone
     */
    @Transactional
    public Optional<Featureset> discardFailed(UUID id, String reason) {
        Optional<Featureset> found = featuresetRepo.findById(id);
        found.ifPresent(featureset -> {
            if (failurePolicy == FailurePolicy.MARK_FAILED) {
                featureset.markFailed(reason);
                featuresetRepo.save(featureset);
                log.warn("Featureset {} ('{}') FAILED: {}", id, featureset.getName(), reason);
            } else {
                featuresetRepo.delete(featureset);
                log.warn("Featureset {} ('{}') deleted after pipeline failure: {}",
                        id, featureset.getName(), reason);
            }
        });
        return found;
    }

    // ------------------------------------------------------------------
    // User actions
    // ------------------------------------------------------------------

    /**
     * Delete an owned featureset and its artifact.
     * A pending job keeps running; its watcher will find the row gone.
     */
    @Transactional
    public void delete(UUID id, String username) {
        Featureset featureset = getOwned(id, username);
        featuresetRepo.delete(featureset);
        storage.deleteQuietly(featureset.getFileUri());
        log.info("Featureset {} deleted by '{}'", id, username);
    }
}
