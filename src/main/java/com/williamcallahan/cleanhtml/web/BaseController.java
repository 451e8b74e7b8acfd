package com.williamcallahan.cleanhtml.web;

import com.williamcallahan.cleanhtml.domain.errors.ApiErrorResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Base controller with the shared error handling.
 */
public abstract class BaseController {

    protected final ExceptionResponseBuilder exceptionBuilder;

    /**
     * Creates a base controller wired to the shared exception response builder.
     */
    protected BaseController(ExceptionResponseBuilder exceptionBuilder) {
        this.exceptionBuilder = exceptionBuilder;
    }

    /**
     * Handles unexpected service failures.
     *
     * @param e the exception that occurred
     * @param operation description of the operation that failed
     * @return 500 error response
     */
    protected ResponseEntity<ApiErrorResponse> handleServiceException(Exception e, String operation) {
        return exceptionBuilder.buildErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR, "Failed to " + operation, e);
    }

    /**
     * Handles rejected input.
     *
     * @param validationException the validation exception
     * @return 400 error response
     */
    protected ResponseEntity<ApiErrorResponse> handleValidationException(IllegalArgumentException validationException) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, validationException.getMessage());
    }
}
