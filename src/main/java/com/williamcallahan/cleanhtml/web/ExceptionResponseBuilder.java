package com.williamcallahan.cleanhtml.web;

import com.williamcallahan.cleanhtml.domain.errors.ApiErrorResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * Builds the error responses shared by all controllers.
 */
@Component
public class ExceptionResponseBuilder {

    /**
     * Builds an error response with status and message.
     *
     * @param status HTTP status code
     * @param message error message
     * @return response carrying an {@link ApiErrorResponse}
     */
    public ResponseEntity<ApiErrorResponse> buildErrorResponse(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message));
    }

    /**
     * Builds an error response that also describes the exception.
     *
     * @param status HTTP status code
     * @param message error message
     * @param exception exception that occurred
     * @return response carrying an {@link ApiErrorResponse} with details
     */
    public ResponseEntity<ApiErrorResponse> buildErrorResponse(HttpStatus status, String message, Exception exception) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message, describeException(exception)));
    }

    /**
     * Describes an exception by type and message.
     *
     * @param exception exception to describe
     * @return formatted details, or null when no exception is provided
     */
    public String describeException(Exception exception) {
        if (exception == null) {
            return null;
        }
        String message = exception.getMessage();
        String typeName = exception.getClass().getSimpleName();
        return message == null || message.isBlank() ? typeName : typeName + ": " + message;
    }
}
