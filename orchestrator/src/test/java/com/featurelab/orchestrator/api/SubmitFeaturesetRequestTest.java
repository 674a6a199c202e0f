package com.featurelab.orchestrator.api;

import com.featurelab.orchestrator.api.dto.SubmitFeaturesetRequest;
import com.featurelab.orchestrator.service.FeaturesetValidationException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Parsing of the flat POST /features body.
 */
class SubmitFeaturesetRequestTest {

    @Test
    void from_splitsReservedKeysFromFeatureFlags() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("featuresetName", "  fs1 ");
        body.put("datasetID", 3);
        body.put("customFeatsCode", "  \n");
        body.put("period", true);
        body.put("skew", false);
        body.put("amplitude", "true");
        body.put("std", null);

        SubmitFeaturesetRequest req = SubmitFeaturesetRequest.from(body);

        assertThat(req.featuresetName()).isEqualTo("fs1");
        assertThat(req.datasetId()).isEqualTo(3L);
        assertThat(req.customFeatsCode()).isEmpty();
        assertThat(req.selectedFeatures()).containsExactly("period", "amplitude");
    }

    @Test
    void from_acceptsDatasetIdAsString() {
        SubmitFeaturesetRequest req = SubmitFeaturesetRequest.from(Map.of("datasetID", " 42 "));

        assertThat(req.datasetId()).isEqualTo(42L);
        assertThat(req.featuresetName()).isNull();
        assertThat(req.selectedFeatures()).isEmpty();
    }

    @Test
    void from_missingOrInvalidDatasetId_isValidationError() {
        assertThatThrownBy(() -> SubmitFeaturesetRequest.from(Map.of("amplitude", true)))
                .isInstanceOf(FeaturesetValidationException.class);
        assertThatThrownBy(() -> SubmitFeaturesetRequest.from(Map.of("datasetID", "abc")))
                .isInstanceOf(FeaturesetValidationException.class)
                .hasMessageContaining("abc");
    }
}
