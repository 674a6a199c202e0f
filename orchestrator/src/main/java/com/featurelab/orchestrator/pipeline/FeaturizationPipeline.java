package com.featurelab.orchestrator.pipeline;

import com.featurelab.orchestrator.feature.FeatureRegistry;
import com.featurelab.orchestrator.feature.TimeSeries;
import com.featurelab.orchestrator.pool.TaskFuture;
import com.featurelab.orchestrator.pool.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the featurization task graph and hands it to the worker pool.
 *
 * <pre>
 *   load (per file) ──┬── label (per series) ───────────────────────┐
 *                     └── featurize (per series) ── assemble ── impute ── save
 * </pre>
 *
 * Nothing here waits: {@link #submit} returns once every task is queued, and
 * the returned handle resolves when the save task finishes. Any stage error
 * except a per-feature failure propagates down the graph and fails the handle.
 */
@Component
public class FeaturizationPipeline {

    private static final Logger log = LoggerFactory.getLogger(FeaturizationPipeline.class);

    private final WorkerPool        pool;
    private final TimeSeriesLoader  loader;
    private final FeatureRegistry   features;
    private final FeatureImputer    imputer;
    private final FeaturesetStorage storage;

    public FeaturizationPipeline(WorkerPool pool,
                                 TimeSeriesLoader loader,
                                 FeatureRegistry features,
                                 FeatureImputer imputer,
                                 FeaturesetStorage storage) {
        this.pool     = pool;
        this.loader   = loader;
        this.features = features;
        this.imputer  = imputer;
        this.storage  = storage;
    }

    /**
     * Submit the full graph for one featureset.
     *
     * @throws UnsupportedOperationException if a custom feature script is supplied
     */
    public PipelineHandle submit(FeaturizationRequest request) {
        if (request.customScriptPath() != null) {
            throw new UnsupportedOperationException("Custom feature scripts are not supported");
        }
        List<String> featureNames = request.features();
        Path outputPath = request.outputPath();

        // 1. Load every series, one task per file.
        List<TaskFuture<TimeSeries>> series =
                pool.map("load", loader::load, request.fileUris());

        // 2. Extract labels.
        List<TaskFuture<String>> labels =
                pool.mapResults("label", TimeSeries::label, series);

        // 3. Featurize each series. Never fails per item.
        List<TaskFuture<Map<String, Double>>> rows =
                pool.mapResults("featurize", ts -> featurizeSingle(ts, featureNames), series);

        // 4. Assemble one table from all rows, paired with their series.
        List<TaskFuture<?>> assembleDeps = new ArrayList<>(rows);
        assembleDeps.addAll(series);
        TaskFuture<FeatureTable> assembled = pool.submit("assemble",
                () -> FeatureTable.assemble(featureNames, joinAll(rows), joinAll(series)),
                assembleDeps);

        // 5. Impute missing values into a new table.
        TaskFuture<FeatureTable> imputed = pool.submit("impute",
                () -> imputer.impute(assembled.join()),
                List.of(assembled));

        // 6. Persist with labels; this is the task the caller tracks.
        List<TaskFuture<?>> saveDeps = new ArrayList<>(labels);
        saveDeps.add(imputed);
        TaskFuture<Path> saved = pool.submit("save",
                () -> storage.write(imputed.join(), joinAll(labels), outputPath),
                saveDeps);

        log.info("Submitted featurization graph {} ({} series, features={})",
                saved.key(), request.fileUris().size(), featureNames);
        return new PipelineHandle(saved.key(), saved.result());
    }

    /**
     * Compute the requested features for one series.
     *
     * A feature that throws yields NaN instead of failing the task, so one bad
     * series cannot abort the whole featureset; the gap is filled later by the
     * imputation stage.
     */
    Map<String, Double> featurizeSingle(TimeSeries series, List<String> featureNames) {
        Map<String, Double> values = new LinkedHashMap<>();
        for (String name : featureNames) {
            double value;
            try {
                value = features.compute(name, series);
            } catch (RuntimeException e) {
                log.warn("Feature '{}' failed for series '{}', recording a missing value: {}",
                        name, series.name(), e.getMessage());
                value = Double.NaN;
            }
            values.put(name, value);
        }
        return values;
    }

    private static <T> List<T> joinAll(List<TaskFuture<T>> futures) {
        List<T> values = new ArrayList<>(futures.size());
        for (TaskFuture<T> f : futures) {
            values.add(f.join());
        }
        return values;
    }
}
