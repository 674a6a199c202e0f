package com.featurelab.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

/**
 * One submitted feature-extraction computation and, once it completes,
 * the artifact it produced.
 *
 * The row is written in PENDING state together with the worker-pool task key
 * of the pipeline's terminal task. The completion watcher owns the only
 * transition out of PENDING:
 *   - success: task_id cleared, finished_at stamped  → COMPLETED
 *   - failure: row deleted (default) or task_id cleared and error kept → FAILED
 *
 * Invariant: task_id is non-null iff state = PENDING;
 *            finished_at is non-null iff state = COMPLETED.
 *
 * DB table: featuresets  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "featuresets")
public class Featureset {

    private static final String FEATURE_SEPARATOR = ",";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    // User-supplied label; not unique.
    @Column(nullable = false)
    private String name;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "project_id", nullable = false)
    private Project project;

    // Generated before the pipeline runs, so the file may not exist yet.
    @Column(name = "file_uri", nullable = false, columnDefinition = "TEXT")
    private String fileUri;

    // Comma-separated feature names, in the order they appear in the artifact.
    @Column(name = "features_list", nullable = false, columnDefinition = "TEXT")
    private String featuresList;

    @Column(name = "custom_features_script", columnDefinition = "TEXT")
    private String customFeaturesScript;

    // Key of the pipeline's terminal task; null once the job has resolved.
    @Column(name = "task_id")
    private String taskId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private FeaturesetState state = FeaturesetState.PENDING;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "finished_at")
    private Instant finishedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Featureset() {}   // required by JPA

    public Featureset(String name, String fileUri, Project project, List<String> features) {
        this.name         = name;
        this.fileUri      = fileUri;
        this.project      = project;
        this.featuresList = String.join(FEATURE_SEPARATOR, features);
    }

    // ------------------------------------------------------------------
    // State transitions
    // ------------------------------------------------------------------

    /** Record the task key returned by the worker pool at submission time. */
    public void assignTask(String taskId) {
        requirePending("assign a task to");
        this.taskId = taskId;
    }

    /** PENDING → COMPLETED. */
    public void markCompleted(Instant at) {
        requirePending("complete");
        this.taskId     = null;
        this.finishedAt = at;
        this.state      = FeaturesetState.COMPLETED;
    }

    /** PENDING → FAILED. Only used when failed jobs are kept rather than deleted. */
    public void markFailed(String errorMessage) {
        requirePending("fail");
        this.taskId       = null;
        this.errorMessage = errorMessage;
        this.state        = FeaturesetState.FAILED;
    }

    private void requirePending(String action) {
        if (state != FeaturesetState.PENDING) {
            throw new IllegalStateException(
                    "Cannot " + action + " featureset " + id + " in state " + state);
        }
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID            getId()                   { return id; }
    public String          getName()                 { return name; }
    public Project         getProject()              { return project; }
    public String          getFileUri()              { return fileUri; }
    public String          getCustomFeaturesScript() { return customFeaturesScript; }
    public String          getTaskId()               { return taskId; }
    public FeaturesetState getState()                { return state; }
    public String          getErrorMessage()         { return errorMessage; }
    public Instant         getCreatedAt()            { return createdAt; }
    public Instant         getFinishedAt()           { return finishedAt; }

    public List<String> getFeaturesList() {
        if (featuresList == null || featuresList.isEmpty()) return List.of();
        return Arrays.asList(featuresList.split(FEATURE_SEPARATOR));
    }

    public boolean isPending() {
        return state == FeaturesetState.PENDING;
    }
}
