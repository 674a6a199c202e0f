package com.featurelab.orchestrator.api;

import com.featurelab.orchestrator.feature.FeatureManifest;
import com.featurelab.orchestrator.feature.FeatureRegistry;
import com.featurelab.orchestrator.model.Featureset;
import com.featurelab.orchestrator.model.TestEntities;
import com.featurelab.orchestrator.service.FeaturesetAccessException;
import com.featurelab.orchestrator.service.FeaturesetService;
import com.featurelab.orchestrator.service.FeaturesetValidationException;
import com.featurelab.orchestrator.service.FeaturizationService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for FeaturesetController and ApiExceptionHandler.
 *
 * @WebMvcTest spins up only the web layer (no DB, no worker pool).
 * The services are replaced by mocks so we can control their behaviour precisely.
 */
@WebMvcTest(FeaturesetController.class)
class FeaturesetControllerTest {

    static final String USER = FeaturesetController.USER_HEADER;

    @Autowired MockMvc mockMvc;
    @MockitoBean FeaturizationService featurizationService;
    @MockitoBean FeaturesetService    featuresetService;
    @MockitoBean FeatureRegistry      catalog;

    // ------------------------------------------------------------------
    // POST /features
    // ------------------------------------------------------------------

    @Test
    void submit_validRequest_returnsPendingFeaturesetAndRefreshAction() throws Exception {
        Featureset featureset = fakeFeatureset();
        featureset.assignTask("t-123");
        when(featurizationService.submit(eq("fs1"), eq(3L), eq(""), eq(List.of("amplitude", "period")), eq("alice")))
                .thenReturn(featureset);

        mockMvc.perform(post("/features")
                        .header(USER, "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"featuresetName":"fs1","datasetID":3,"customFeatsCode":"",
                                 "amplitude":true,"skew":false,"period":true}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.action").value("featurelab/FETCH_FEATURESETS"))
                .andExpect(jsonPath("$.data.name").value("fs1"))
                .andExpect(jsonPath("$.data.taskId").value("t-123"))
                .andExpect(jsonPath("$.data.state").value("PENDING"))
                .andExpect(jsonPath("$.data.featuresList[1]").value("period"));
    }

    @Test
    void submit_noFeatureSelected_returns400WithMessage() throws Exception {
        when(featurizationService.submit(anyString(), anyLong(), anyString(), any(), anyString()))
                .thenThrow(new FeaturesetValidationException("At least one feature must be selected."));

        mockMvc.perform(post("/features")
                        .header(USER, "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"featuresetName":"fs1","datasetID":3,"customFeatsCode":"","amplitude":false}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.message").value("At least one feature must be selected."))
                .andExpect(jsonPath("$.data").doesNotExist());
    }

    @Test
    void submit_missingDatasetId_returns400_withoutCallingService() throws Exception {
        mockMvc.perform(post("/features")
                        .header(USER, "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"featuresetName":"fs1","amplitude":true}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("error"));

        verifyNoInteractions(featurizationService);
    }

    @Test
    void submit_foreignDataset_returns403() throws Exception {
        when(featurizationService.submit(anyString(), anyLong(), anyString(), any(), anyString()))
                .thenThrow(new FeaturesetAccessException("No such data set"));

        mockMvc.perform(post("/features")
                        .header(USER, "mallory")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"featuresetName":"fs1","datasetID":3,"amplitude":true}
                                """))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.message").value("No such data set"));
    }

    @Test
    void submit_withoutUserHeader_returns400() throws Exception {
        mockMvc.perform(post("/features")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"featuresetName\":\"fs1\",\"datasetID\":3,\"amplitude\":true}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(featurizationService);
    }

    // ------------------------------------------------------------------
    // GET /features, GET /features/{id}, GET /features/catalog
    // ------------------------------------------------------------------

    @Test
    void list_returnsVisibleFeaturesets_withEmptyTaskIdOnceResolved() throws Exception {
        Featureset done = fakeFeatureset();
        done.markCompleted(Instant.parse("2026-03-01T12:00:00Z"));
        when(featuresetService.listVisible("alice")).thenReturn(List.of(done));

        mockMvc.perform(get("/features").header(USER, "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].name").value("fs1"))
                .andExpect(jsonPath("$.data[0].state").value("COMPLETED"))
                .andExpect(jsonPath("$.data[0].taskId").value(""));
    }

    @Test
    void get_unknownId_returns404() throws Exception {
        UUID unknown = UUID.randomUUID();
        when(featuresetService.getOwned(unknown, "alice"))
                .thenThrow(new ResponseStatusException(HttpStatus.NOT_FOUND, "Featureset not found: " + unknown));

        mockMvc.perform(get("/features/{id}", unknown).header(USER, "alice"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value("error"));
    }

    @Test
    void get_malformedId_returns400() throws Exception {
        mockMvc.perform(get("/features/{id}", "not-a-uuid").header(USER, "alice"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void catalog_listsFeatureManifests() throws Exception {
        when(catalog.manifests()).thenReturn(List.of(
                new FeatureManifest("amplitude", "Half the range."),
                new FeatureManifest("period", "Dominant period.")));

        mockMvc.perform(get("/features/catalog"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].name").value("amplitude"))
                .andExpect(jsonPath("$.data[1].description").value("Dominant period."));
    }

    // ------------------------------------------------------------------
    // DELETE and PUT /features/{id}
    // ------------------------------------------------------------------

    @Test
    void delete_owned_returnsRefreshAction() throws Exception {
        UUID id = UUID.randomUUID();

        mockMvc.perform(delete("/features/{id}", id).header(USER, "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.action").value("featurelab/FETCH_FEATURESETS"));

        verify(featuresetService).delete(id, "alice");
    }

    @Test
    void delete_notOwned_returns403() throws Exception {
        UUID id = UUID.randomUUID();
        doThrow(new FeaturesetAccessException("No such featureset"))
                .when(featuresetService).delete(id, "bob");

        mockMvc.perform(delete("/features/{id}", id).header(USER, "bob"))
                .andExpect(status().isForbidden());
    }

    @Test
    void put_isNotImplemented() throws Exception {
        mockMvc.perform(put("/features/{id}", UUID.randomUUID())
                        .header(USER, "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isNotImplemented())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.message")
                        .value("Functionality for this endpoint is not yet implemented."));
    }

    // ------------------------------------------------------------------
    // Unexpected errors
    // ------------------------------------------------------------------

    @Test
    void unexpectedError_returns500() throws Exception {
        when(featuresetService.listVisible("alice")).thenThrow(new IllegalStateException("db down"));

        mockMvc.perform(get("/features").header(USER, "alice"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.status").value("error"));
    }

    @Test
    void unsupportedMethod_keeps405() throws Exception {
        mockMvc.perform(post("/features/{id}", UUID.randomUUID()).header(USER, "alice"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.status").value("error"));

        verifyNoInteractions(featurizationService, featuresetService);
    }

    @Test
    void unknownPath_keeps404() throws Exception {
        mockMvc.perform(get("/no-such-endpoint").header(USER, "alice"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value("error"));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Featureset fakeFeatureset() {
        return TestEntities.featureset("fs1", TestEntities.project(1L, "alice"), List.of("amplitude", "period"));
    }
}
