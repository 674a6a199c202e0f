package com.featurelab.orchestrator.api;

import com.featurelab.orchestrator.api.dto.ApiResponse;
import com.featurelab.orchestrator.api.dto.FeatureResponse;
import com.featurelab.orchestrator.api.dto.FeaturesetResponse;
import com.featurelab.orchestrator.api.dto.SubmitFeaturesetRequest;
import com.featurelab.orchestrator.feature.FeatureRegistry;
import com.featurelab.orchestrator.model.Featureset;
import com.featurelab.orchestrator.notify.Notification;
import com.featurelab.orchestrator.service.FeaturesetService;
import com.featurelab.orchestrator.service.FeaturizationService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for featuresets.
 *
 * POST   /features          : create a featureset and start computing it
 * GET    /features          : featuresets visible to the caller, newest first
 * GET    /features/catalog  : features that may be selected
 * GET    /features/{id}     : one owned featureset
 * DELETE /features/{id}     : delete an owned featureset and its artifact
 * PUT    /features/{id}     : not implemented (501)
 *
 * The caller is identified by the X-Auth-User header set by the gateway.
 */
@RestController
@RequestMapping("/features")
public class FeaturesetController {

    public static final String USER_HEADER = "X-Auth-User";

    static final String NOT_IMPLEMENTED_MESSAGE =
            "Functionality for this endpoint is not yet implemented.";

    private final FeaturizationService featurizationService;
    private final FeaturesetService    featuresetService;
    private final FeatureRegistry      catalog;

    public FeaturesetController(FeaturizationService featurizationService,
                                FeaturesetService featuresetService,
                                FeatureRegistry catalog) {
        this.featurizationService = featurizationService;
        this.featuresetService    = featuresetService;
        this.catalog              = catalog;
    }

    /**
     * Submit a new featureset. Returns as soon as the computation is queued;
     * completion is announced on GET /events.
     *
     * Example:
     *   curl -X POST http://localhost:8080/features \
     *     -H "X-Auth-User: alice" -H "Content-Type: application/json" \
     *     -d '{"featuresetName":"fs1","datasetID":3,"customFeatsCode":"","amplitude":true}'
     */
    @PostMapping
    public ApiResponse<FeaturesetResponse> submit(@RequestHeader(USER_HEADER) String username,
                                                  @RequestBody Map<String, Object> body) {
        SubmitFeaturesetRequest req = SubmitFeaturesetRequest.from(body);
        Featureset featureset = featurizationService.submit(
                req.featuresetName(), req.datasetId(), req.customFeatsCode(),
                req.selectedFeatures(), username);
        return ApiResponse.success(FeaturesetResponse.from(featureset), Notification.FETCH_FEATURESETS);
    }

    @GetMapping
    public ApiResponse<List<FeaturesetResponse>> list(@RequestHeader(USER_HEADER) String username) {
        return ApiResponse.success(featuresetService.listVisible(username).stream()
                .map(FeaturesetResponse::from)
                .toList());
    }

    @GetMapping("/catalog")
    public ApiResponse<List<FeatureResponse>> catalog() {
        return ApiResponse.success(catalog.manifests().stream()
                .map(FeatureResponse::from)
                .toList());
    }

    /** 404 if the id is unknown, 403 if it belongs to someone else. */
    @GetMapping("/{id}")
    public ApiResponse<FeaturesetResponse> get(@RequestHeader(USER_HEADER) String username,
                                               @PathVariable UUID id) {
        return ApiResponse.success(FeaturesetResponse.from(featuresetService.getOwned(id, username)));
    }

    /**
     * Delete an owned featureset. A computation still running for it is not
     * cancelled; its result is discarded when it finishes.
     */
    @DeleteMapping("/{id}")
    public ApiResponse<Void> delete(@RequestHeader(USER_HEADER) String username,
                                    @PathVariable UUID id) {
        featuresetService.delete(id, username);
        return ApiResponse.success(null, Notification.FETCH_FEATURESETS);
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> update(@PathVariable UUID id) {
        return ResponseEntity.status(HttpStatus.NOT_IMPLEMENTED)
                .body(ApiResponse.error(NOT_IMPLEMENTED_MESSAGE));
    }
}
