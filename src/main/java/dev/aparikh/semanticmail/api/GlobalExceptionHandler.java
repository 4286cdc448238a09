package dev.aparikh.semanticmail.api;

import dev.aparikh.semanticmail.error.PipelineException;
import dev.aparikh.semanticmail.sync.SyncException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API endpoints.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationErrors(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining(", "));

        ErrorResponse error = new ErrorResponse(
                "Validation failed: " + message,
                "VALIDATION_ERROR",
                Instant.now()
        );

        return ResponseEntity.badRequest().body(error);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException ex) {
        return ResponseEntity.badRequest()
                .body(new ErrorResponse(ex.getMessage(), "VALIDATION_ERROR", Instant.now()));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(new ErrorResponse("Missing " + ex.getHeaderName() + " header", "UNAUTHORIZED", Instant.now()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        ErrorResponse error = new ErrorResponse(
                ex.getMessage(),
                "INVALID_ARGUMENT",
                Instant.now()
        );

        return ResponseEntity.badRequest().body(error);
    }

    @ExceptionHandler(SyncException.class)
    public ResponseEntity<ErrorResponse> handleSyncException(SyncException ex) {
        HttpStatus status = switch (ex.reason()) {
            case AUTH_EXPIRED -> HttpStatus.UNAUTHORIZED;
            case ALREADY_RUNNING -> HttpStatus.CONFLICT;
            case STORE_UNAVAILABLE, MAILBOX_UNAVAILABLE, EMBEDDING_UNAVAILABLE, CANCELLED ->
                    HttpStatus.SERVICE_UNAVAILABLE;
        };
        log.warn("Sync request failed with {}: {}", ex.reason(), ex.getMessage());

        return ResponseEntity.status(status)
                .body(new ErrorResponse(ex.getMessage(), ex.reason().name(), Instant.now()));
    }

    @ExceptionHandler(PipelineException.class)
    public ResponseEntity<ErrorResponse> handlePipelineException(PipelineException ex) {
        if (ex.isTransient()) {
            log.warn("Dependency unavailable: {}", ex.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(new ErrorResponse("A dependency is temporarily unavailable", "DEPENDENCY_UNAVAILABLE",
                            Instant.now()));
        }
        return handleRuntimeException(ex);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleRuntimeException(RuntimeException ex) {
        log.error("Unexpected error during API operation", ex);

        ErrorResponse error = new ErrorResponse(
                "An unexpected error occurred",
                "INTERNAL_ERROR",
                Instant.now()
        );

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }
}
