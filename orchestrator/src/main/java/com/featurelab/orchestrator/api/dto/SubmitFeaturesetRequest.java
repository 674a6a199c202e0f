package com.featurelab.orchestrator.api.dto;

import com.featurelab.orchestrator.service.FeaturesetValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Request body for POST /features.
 *
 * The body is a flat JSON object: three reserved keys plus one boolean per
 * catalog feature, e.g.
 * <pre>
 *   {"featuresetName": "fs1", "datasetID": 3, "customFeatsCode": "",
 *    "amplitude": true, "period": true, "skew": false}
 * </pre>
 * A feature counts as selected when its value is {@code true} (or the
 * string "true"). Whether the name is actually in the catalog is checked
 * later, by the service.
 */
public record SubmitFeaturesetRequest(String featuresetName,
                                      long datasetId,
                                      String customFeatsCode,
                                      List<String> selectedFeatures) {

    public static final String NAME_KEY         = "featuresetName";
    public static final String DATASET_KEY      = "datasetID";
    public static final String CUSTOM_CODE_KEY  = "customFeatsCode";

    private static final Set<String> RESERVED = Set.of(NAME_KEY, DATASET_KEY, CUSTOM_CODE_KEY);

    public SubmitFeaturesetRequest {
        selectedFeatures = List.copyOf(selectedFeatures);
    }

    /**
     * @throws FeaturesetValidationException if datasetID is missing or not an integer
     */
    public static SubmitFeaturesetRequest from(Map<String, Object> body) {
        Object name = body.get(NAME_KEY);
        Object code = body.get(CUSTOM_CODE_KEY);

        List<String> selected = new ArrayList<>();
        for (Map.Entry<String, Object> entry : body.entrySet()) {
            if (!RESERVED.contains(entry.getKey()) && isTrue(entry.getValue())) {
                selected.add(entry.getKey());
            }
        }
        return new SubmitFeaturesetRequest(
                name == null ? null : name.toString().trim(),
                parseDatasetId(body.get(DATASET_KEY)),
                code == null ? "" : code.toString().trim(),
                selected);
    }

    private static boolean isTrue(Object value) {
        return Boolean.TRUE.equals(value) || "true".equals(value);
    }

    private static long parseDatasetId(Object raw) {
        if (raw instanceof Number n) {
            return n.longValue();
        }
        if (raw instanceof String s && !s.isBlank()) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                throw new FeaturesetValidationException("Invalid data set id: " + s);
            }
        }
        throw new FeaturesetValidationException("A data set must be selected.");
    }
}
