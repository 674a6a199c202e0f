package com.featurelab.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Envelope for every HTTP response.
 *
 * @param status  "success" or "error"
 * @param data    response body on success
 * @param message user-facing text on error
 * @param action  client action to dispatch after a success, e.g. a list refresh
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(String status, T data, String message, String action) {

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>("success", data, null, null);
    }

    public static <T> ApiResponse<T> success(T data, String action) {
        return new ApiResponse<>("success", data, null, action);
    }

    public static <T> ApiResponse<T> error(String message) {
        return new ApiResponse<>("error", null, message, null);
    }
}
