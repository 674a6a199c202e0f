package com.featurelab.orchestrator.api;

import com.featurelab.orchestrator.api.dto.ApiResponse;
import com.featurelab.orchestrator.service.FeaturesetAccessException;
import com.featurelab.orchestrator.service.FeaturesetValidationException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

/**
 * Maps exceptions to {@link ApiResponse#error} bodies.
 *
 * 400 validation and malformed requests, 403 ownership, whatever status a
 * ResponseStatusException carries (404 for missing rows). Other framework
 * errors (unknown path, wrong method) keep their own status; anything else
 * is a 500.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(FeaturesetValidationException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(FeaturesetValidationException e) {
        return respond(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler({MissingRequestHeaderException.class,
                       HttpMessageNotReadableException.class,
                       MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiResponse<Void>> handleBadRequest(Exception e, HttpServletRequest request) {
        log.debug("Bad request {} {}: {}", request.getMethod(), request.getRequestURI(), e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Malformed request.");
    }

    @ExceptionHandler(FeaturesetAccessException.class)
    public ResponseEntity<ApiResponse<Void>> handleAccess(FeaturesetAccessException e, HttpServletRequest request) {
        log.warn("Access denied on {} {}: {}", request.getMethod(), request.getRequestURI(), e.getMessage());
        return respond(HttpStatus.FORBIDDEN, e.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiResponse<Void>> handleStatus(ResponseStatusException e) {
        return respond(HttpStatus.valueOf(e.getStatusCode().value()), e.getReason());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleAll(Exception e, HttpServletRequest request) {
        if (e instanceof ErrorResponse framework) {
            HttpStatus status = HttpStatus.valueOf(framework.getStatusCode().value());
            log.debug("Rejected {} {} with {}: {}", request.getMethod(), request.getRequestURI(),
                    status.value(), e.getMessage());
            String detail = framework.getBody().getDetail();
            return respond(status, detail != null ? detail : status.getReasonPhrase());
        }
        log.error("Unhandled exception on {} {}", request.getMethod(), request.getRequestURI(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error.");
    }

    private static ResponseEntity<ApiResponse<Void>> respond(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ApiResponse.error(message));
    }
}
