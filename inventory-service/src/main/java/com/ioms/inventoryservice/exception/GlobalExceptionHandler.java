package com.ioms.inventoryservice.exception;

import com.ioms.common.dto.ErrorResponse;
import com.ioms.common.dto.ValidationErrorResponse;
import com.ioms.common.exception.DuplicateResourceException;
import com.ioms.common.exception.InsufficientStockException;
import com.ioms.common.exception.InvalidStateTransitionException;
import com.ioms.common.exception.ReferentialIntegrityException;
import com.ioms.common.exception.ResourceNotFoundException;
import com.ioms.inventoryservice.query.InvalidFilterValueException;
import com.ioms.inventoryservice.query.InvalidPathException;
import com.ioms.inventoryservice.query.RelatedQueryException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Generate a unique correlation ID for tracking requests
     */
    private String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String errorCode, String message,
                                                  HttpServletRequest request) {
        ErrorResponse errorResponse = ErrorResponse.builder()
                .status(status.value())
                .error(message)
                .path(request.getRequestURI())
                .timestamp(LocalDateTime.now())
                .errorCode(errorCode)
                .correlationId(generateCorrelationId())
                .build();

        return new ResponseEntity<>(errorResponse, status);
    }

    /**
     * Handles ResourceNotFoundException (404 - Not Found)
     * Note: Logging is done at service layer with more context
     */
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFoundException(
            ResourceNotFoundException ex,
            HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, "RESOURCE_NOT_FOUND", ex.getMessage(), request);
    }

    /**
     * Handles DuplicateResourceException (409 - Conflict)
     * Thrown when a unique business key (name, sku, email, one payment per order) is already taken
     */
    @ExceptionHandler(DuplicateResourceException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateResourceException(
            DuplicateResourceException ex,
            HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, "DUPLICATE_RESOURCE", ex.getMessage(), request);
    }

    /**
     * Handles ReferentialIntegrityException (409 - Conflict)
     * Thrown when deleting an entity that other rows still reference
     */
    @ExceptionHandler(ReferentialIntegrityException.class)
    public ResponseEntity<ErrorResponse> handleReferentialIntegrityException(
            ReferentialIntegrityException ex,
            HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, "REFERENTIAL_INTEGRITY_VIOLATION", ex.getMessage(), request);
    }

    /**
     * Handles InvalidStateTransitionException (409 - Conflict)
     * Thrown when confirming an order or payment that is no longer PENDING
     */
    @ExceptionHandler(InvalidStateTransitionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidStateTransitionException(
            InvalidStateTransitionException ex,
            HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, "INVALID_STATE_TRANSITION", ex.getMessage(), request);
    }

    /**
     * Handles InsufficientStockException (422 - Unprocessable Entity)
     * Note: Logging is done at service layer with more context (product, requested and missing quantity)
     */
    @ExceptionHandler(InsufficientStockException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientStockException(
            InsufficientStockException ex,
            HttpServletRequest request) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "INSUFFICIENT_STOCK", ex.getMessage(), request);
    }

    /**
     * Handles InvalidPathException (400 - Bad Request)
     * Thrown when a join, filter or ordering names a relation or field the entity does not have
     */
    @ExceptionHandler(InvalidPathException.class)
    public ResponseEntity<ErrorResponse> handleInvalidPathException(
            InvalidPathException ex,
            HttpServletRequest request) {
        log.debug("Rejected related query - Path: {} - {}", request.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "INVALID_PATH", ex.getMessage(), request);
    }

    @ExceptionHandler(InvalidFilterValueException.class)
    public ResponseEntity<ErrorResponse> handleInvalidFilterValueException(
            InvalidFilterValueException ex,
            HttpServletRequest request) {
        log.debug("Rejected related query - Path: {} - {}", request.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "INVALID_FILTER_VALUE", ex.getMessage(), request);
    }

    /**
     * Handles any other RelatedQueryException (400 - Bad Request), including wrapped execution failures
     */
    @ExceptionHandler(RelatedQueryException.class)
    public ResponseEntity<ErrorResponse> handleRelatedQueryException(
            RelatedQueryException ex,
            HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_QUERY", ex.getMessage(), request);
    }

    /**
     * Handles DataIntegrityViolationException (409 - Conflict)
     * Raised by database constraints, e.g. the stock CHECK (reserved <= qty) or a unique key race
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleDataIntegrityViolationException(
            DataIntegrityViolationException ex,
            HttpServletRequest request) {
        log.warn("Constraint violation - Path: {} - {}", request.getRequestURI(), ex.getMostSpecificCause().getMessage());
        return respond(HttpStatus.CONFLICT, "DATA_INTEGRITY_VIOLATION",
                "The request conflicts with existing data", request);
    }

    /**
     * Handles ObjectOptimisticLockingFailureException (409 - Conflict)
     * A concurrent transaction changed the same stock or order row first
     */
    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleOptimisticLockingFailure(
            ObjectOptimisticLockingFailureException ex,
            HttpServletRequest request) {
        log.warn("Concurrent modification - Path: {} - {}", request.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.CONFLICT, "CONCURRENT_MODIFICATION",
                "The resource was modified concurrently, please retry", request);
    }

    /**
     * Handles MethodArgumentNotValidException (400 - Bad Request)
     * Thrown when request validation fails (@Valid annotation)
     * Returns all field validation errors
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ValidationErrorResponse> handleValidationException(
            MethodArgumentNotValidException ex,
            HttpServletRequest request) {

        List<ValidationErrorResponse.FieldViolation> violations = ex.getBindingResult().getFieldErrors().stream()
                .map(fieldError -> ValidationErrorResponse.FieldViolation.builder()
                        .field(fieldError.getField())
                        .message(fieldError.getDefaultMessage())
                        .rejectedValue(fieldError.getRejectedValue())
                        .build())
                .toList();

        String correlationId = generateCorrelationId();
        log.debug("[{}] Validation failed - Path: {} - Violations: {}", correlationId, request.getRequestURI(), violations.size());

        ValidationErrorResponse errorResponse = ValidationErrorResponse.builder()
                .status(HttpStatus.BAD_REQUEST.value())
                .error("Validation failed")
                .path(request.getRequestURI())
                .timestamp(LocalDateTime.now())
                .violations(violations)
                .errorCode("VALIDATION_FAILED")
                .correlationId(correlationId)
                .build();

        return new ResponseEntity<>(errorResponse, HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles MethodArgumentTypeMismatchException (400 - Bad Request)
     * e.g. a path variable that is not a UUID
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatchException(
            MethodArgumentTypeMismatchException ex,
            HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT",
                String.format("Invalid value '%s' for parameter '%s'", ex.getValue(), ex.getName()), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleMessageNotReadableException(
            HttpMessageNotReadableException ex,
            HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST", "Request body is missing or malformed", request);
    }

    /**
     * Handles IllegalArgumentException (400 - Bad Request)
     * Note: Logging is done at service layer with more context
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(
            IllegalArgumentException ex,
            HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), request);
    }

    /**
     * Handles all other unexpected exceptions (500 - Internal Server Error)
     * Generic handler for any unhandled exceptions
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGlobalException(
            Exception ex,
            HttpServletRequest request) {

        String correlationId = generateCorrelationId();
        // Log the full exception with stack trace for debugging
        log.error("[{}] Unexpected error occurred - Path: {} - Exception: {}",
                correlationId,
                request.getRequestURI(),
                ex.getMessage(),
                ex);

        // Return generic message to client (avoid exposing internal details)
        ErrorResponse errorResponse = ErrorResponse.builder()
                .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
                .error("An unexpected error occurred. Please contact support if the problem persists.")
                .path(request.getRequestURI())
                .timestamp(LocalDateTime.now())
                .errorCode("INTERNAL_SERVER_ERROR")
                .correlationId(correlationId)
                .build();

        return new ResponseEntity<>(errorResponse, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
