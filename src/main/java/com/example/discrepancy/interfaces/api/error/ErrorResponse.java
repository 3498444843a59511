package com.example.discrepancy.interfaces.api.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.http.HttpStatusCode;

import java.time.Instant;
import java.util.Map;

/**
 * JSON envelope returned for every failed API call. {@code details} is omitted when the failure has no
 * structured context.
 */
public record ErrorResponse(
        Instant timestamp,
        int status,
        String error,
        String message,
        String path,
        @JsonInclude(JsonInclude.Include.NON_NULL) Map<String, Object> details
) {
    /**
     * Builds the envelope stamped with the current time.
     *
     * @param status  HTTP status returned with the envelope
     * @param error   stable error code, e.g. {@code TASK_NOT_FOUND}
     * @param message human readable explanation
     * @param path    request path that produced the error
     * @param details structured context, {@code null} or empty when the failure has none
     * @return populated response object
     */
    public static ErrorResponse of(HttpStatusCode status, String error, String message, String path, Map<String, Object> details) {
        return new ErrorResponse(Instant.now(), status.value(), error, message, path,
                details == null || details.isEmpty() ? null : Map.copyOf(details));
    }
}
