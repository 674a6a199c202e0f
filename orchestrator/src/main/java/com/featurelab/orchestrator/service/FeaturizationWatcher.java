package com.featurelab.orchestrator.service;

import com.featurelab.orchestrator.model.Featureset;
import com.featurelab.orchestrator.notify.Notification;
import com.featurelab.orchestrator.notify.NotificationEmitter;
import com.featurelab.orchestrator.pipeline.FeaturesetStorage;
import com.featurelab.orchestrator.pipeline.PipelineHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;

/**
 * Reconciles a featureset row once its pipeline resolves.
 *
 * {@link #watch} registers a one-shot callback on the pipeline's terminal
 * future and returns immediately. The callback runs exactly once, on the
 * watcher executor, long after the HTTP request that submitted the job has
 * been answered; it therefore reports back only through the
 * {@link NotificationEmitter}.
 *
 * Per job, in order:
 *   1. the row transition (COMPLETED, or deleted/FAILED) is committed;
 *   2. a success or error note is pushed to the owner;
 *   3. a refresh action is pushed, whatever happened before.
 *
 * Failures are terminal: there is no retry.
 */
@Component
public class FeaturizationWatcher {

    private static final Logger log = LoggerFactory.getLogger(FeaturizationWatcher.class);

    private final FeaturesetService   featuresets;
    private final FeaturesetStorage   storage;
    private final NotificationEmitter notifications;
    private final PipelineMetrics     metrics;
    private final Executor            callbackExecutor;
    private final Clock               clock;

    public FeaturizationWatcher(FeaturesetService featuresets,
                                FeaturesetStorage storage,
                                NotificationEmitter notifications,
                                PipelineMetrics metrics,
                                @Qualifier("watcherExecutor") Executor callbackExecutor,
                                Clock clock) {
        this.featuresets      = featuresets;
        this.storage          = storage;
        this.notifications    = notifications;
        this.metrics          = metrics;
        this.callbackExecutor = callbackExecutor;
        this.clock            = clock;
    }

    /**
     * Subscribe to a submitted pipeline. Must be called after the featureset
     * row (with its task id) has been committed.
     *
     * @param owner username the notifications are addressed to
     * @param name  featureset name used in the notification text
     */
    public void watch(PipelineHandle handle, UUID featuresetId, String owner, String name) {
        handle.result().whenCompleteAsync(
                (artifact, error) -> reconcile(handle.taskId(), featuresetId, owner, name,
                        PipelineOutcome.of(artifact, error)),
                callbackExecutor);
        log.debug("Watching task {} for featureset {}", handle.taskId(), featuresetId);
    }

    /**
     * Apply one pipeline outcome. Never throws: an error here is logged and
     * the refresh action is still sent.
     */
    void reconcile(String taskId, UUID featuresetId, String owner, String name, PipelineOutcome outcome) {
        MDC.put("featuresetId", featuresetId.toString());
        MDC.put("taskId", taskId);
        try {
            if (outcome instanceof PipelineOutcome.Succeeded succeeded) {
                onSuccess(featuresetId, owner, name, succeeded);
            } else if (outcome instanceof PipelineOutcome.Failed failed) {
                onFailure(featuresetId, owner, name, failed);
            }
        } catch (Exception e) {
            log.error("Could not reconcile featureset {} after task {}", featuresetId, taskId, e);
        } finally {
            push(owner, Notification.fetchFeaturesets());
            MDC.clear();
        }
    }

    // ------------------------------------------------------------------
    // Outcomes
    // ------------------------------------------------------------------

    private void onSuccess(UUID featuresetId, String owner, String name, PipelineOutcome.Succeeded outcome) {
        metrics.recordCompleted();
        Optional<Featureset> updated = featuresets.markCompleted(featuresetId, clock.instant());
        if (updated.isEmpty()) {
            // Deleted by the user while the pipeline ran: nothing left to complete.
            log.info("Featureset {} vanished before completion, removing orphaned artifact {}",
                    featuresetId, outcome.artifact());
            storage.deleteQuietly(outcome.artifact().toString());
            return;
        }
        push(owner, Notification.note("Calculation of featureset '" + name + "' completed."));
    }

    private void onFailure(UUID featuresetId, String owner, String name, PipelineOutcome.Failed outcome) {
        metrics.recordFailed();
        log.error("Featurization of '{}' ({}) failed: {}", name, featuresetId, outcome.describe(), outcome.cause());
        Optional<Featureset> discarded = featuresets.discardFailed(featuresetId, outcome.describe());
        if (discarded.isEmpty()) {
            log.info("Featureset {} vanished before its failure was recorded", featuresetId);
            return;
        }
        // The save stage may have left a partial file behind.
        storage.deleteQuietly(discarded.get().getFileUri());
        push(owner, Notification.error("Cannot featurize " + name + ": " + outcome.describe()));
    }

    /** Best effort: a dead connection must never break reconciliation. */
    private void push(String owner, Notification notification) {
        try {
            notifications.push(owner, notification);
        } catch (RuntimeException e) {
            log.warn("Could not push {} to '{}': {}", notification.action(), owner, e.getMessage());
        }
    }
}
