package com.example.discrepancy.interfaces.api.error;

import com.example.discrepancy.application.exception.ApplicationException;
import com.example.discrepancy.application.exception.ReportQueueFullException;
import com.example.discrepancy.domain.exception.DomainException;
import com.example.discrepancy.domain.exception.ResultNotAvailableException;
import com.example.discrepancy.domain.exception.TaskNotFoundException;
import com.example.discrepancy.infrastructure.exception.InfrastructureException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.Map;

/**
 * Centralized API-layer exception handler that maps domain/application/infrastructure failures to HTTP responses.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Maps {@link TaskNotFoundException} to a 404 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(TaskNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleTaskNotFound(TaskNotFoundException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.NOT_FOUND, "TASK_NOT_FOUND", ex.details());
    }

    /**
     * Maps {@link ResultNotAvailableException} to a 404 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(ResultNotAvailableException.class)
    public ResponseEntity<ErrorResponse> handleResultNotAvailable(ResultNotAvailableException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.NOT_FOUND, "RESULT_NOT_AVAILABLE", ex.details());
    }

    /**
     * Maps generic domain validation exceptions to a 400 response.
     *
     * @param ex      thrown domain exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(DomainException.class)
    public ResponseEntity<ErrorResponse> handleDomain(DomainException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "DOMAIN_ERROR", ex.details());
    }

    /**
     * Maps a multipart request without the {@code file} part to a 400 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ErrorResponse> handleMissingPart(MissingServletRequestPartException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "FILE_REQUIRED", Map.of("part", ex.getRequestPartName()));
    }

    /**
     * Maps a saturated worker pool to a 503 response so clients retry later.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(ReportQueueFullException.class)
    public ResponseEntity<ErrorResponse> handleQueueFull(ReportQueueFullException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.SERVICE_UNAVAILABLE, "REPORT_QUEUE_FULL", taskDetails(ex));
    }

    /**
     * Maps other application-layer exceptions to a 422 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(ApplicationException.class)
    public ResponseEntity<ErrorResponse> handleApplication(ApplicationException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.UNPROCESSABLE_ENTITY, "APPLICATION_ERROR", taskDetails(ex));
    }

    /**
     * Maps infrastructure exceptions to a 500 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(InfrastructureException.class)
    public ResponseEntity<ErrorResponse> handleInfrastructure(InfrastructureException ex, HttpServletRequest request) {
        log.error("Infrastructure failure on {} (location: {})", request.getRequestURI(), ex.location(), ex);
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "INFRASTRUCTURE_ERROR", null);
    }

    /**
     * Maps an upload above the configured multipart limit to a 413 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleUploadTooLarge(MaxUploadSizeExceededException ex, HttpServletRequest request) {
        Map<String, Object> details = ex.getMaxUploadSize() > 0 ? Map.of("maxUploadSize", ex.getMaxUploadSize()) : null;
        return buildResponse(ex, request, HttpStatus.PAYLOAD_TOO_LARGE, "FILE_TOO_LARGE", details);
    }

    /**
     * Fallback for unexpected exceptions. Spring MVC request errors (unknown route, wrong method or media type)
     * keep the status they carry.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex, HttpServletRequest request) {
        if (ex instanceof org.springframework.web.ErrorResponse mvcError) {
            return handleMvcError(ex, mvcError, request);
        }
        log.error("Unexpected failure on {}", request.getRequestURI(), ex);
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "UNEXPECTED_ERROR", null);
    }

    private ResponseEntity<ErrorResponse> handleMvcError(Exception ex,
                                                         org.springframework.web.ErrorResponse mvcError,
                                                         HttpServletRequest request) {
        HttpStatusCode status = mvcError.getStatusCode();
        if (status.is5xxServerError()) {
            log.error("Request failure on {}", request.getRequestURI(), ex);
        } else {
            log.debug("Rejected request {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        }
        HttpStatus resolved = HttpStatus.resolve(status.value());
        String errorCode = resolved != null ? resolved.name() : "REQUEST_ERROR";
        ErrorResponse body = ErrorResponse.of(status, errorCode, ex.getMessage(), request.getRequestURI(), null);
        return ResponseEntity.status(status).headers(mvcError.getHeaders()).body(body);
    }

    private Map<String, Object> taskDetails(ApplicationException ex) {
        return ex.taskId() == null ? null : Map.of("taskId", ex.taskId());
    }

    /**
     * Central helper that creates a consistent {@link ErrorResponse} envelope.
     *
     * @param error     exception that triggered the handler
     * @param request   incoming HTTP request
     * @param status    HTTP status code to return
     * @param errorCode application-specific error code
     * @param details   structured context exposed next to the message
     * @return response entity containing the serialized error
     */
    private ResponseEntity<ErrorResponse> buildResponse(Throwable error,
                                                       HttpServletRequest request,
                                                       HttpStatusCode status,
                                                       String errorCode,
                                                       Map<String, Object> details) {
        ErrorResponse response = ErrorResponse.of(status, errorCode, error.getMessage(), request.getRequestURI(), details);
        return ResponseEntity.status(status).body(response);
    }
}
