package com.example.barshift.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        Map<String, Object> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach((error) -> {
            String fieldName = ((FieldError) error).getField();
            String errorMessage = error.getDefaultMessage();
            errors.put(fieldName, errorMessage);
        });

        ErrorResponse errorResponse = new ErrorResponse(
                "VALIDATION_ERROR",
                "Request contains invalid fields",
                errors,
                LocalDateTime.now()
        );

        logger.warn("Validation failed: {}", errors);
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        logger.warn("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(
                "VALIDATION_ERROR", "Request body could not be read", null, LocalDateTime.now()));
    }

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusinessException(BusinessException ex) {
        HttpStatus status = statusFor(ex.getErrorCode());
        Map<String, Object> details = null;
        if (ex.getParameters().length > 0) {
            details = Map.of("parameters", Arrays.stream(ex.getParameters()).map(String::valueOf).toList());
        }
        ErrorResponse errorResponse = new ErrorResponse(
                ex.getErrorCode(),
                ex.getMessage(),
                details,
                LocalDateTime.now()
        );

        if (status.is5xxServerError()) {
            logger.error("Request failed [{}]: {}", ex.getErrorCode(), ex.getMessage(), ex);
        } else {
            logger.warn("Request rejected [{}]: {}", ex.getErrorCode(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(errorResponse);
    }

    @ExceptionHandler(PublishBlockedException.class)
    public ResponseEntity<ErrorResponse> handlePublishBlocked(PublishBlockedException ex) {
        Map<String, Object> details = new HashMap<>();
        details.put("violators", List.copyOf(ex.getViolators()));
        details.put("streakLimit", ex.getStreakLimit());
        ErrorResponse errorResponse = new ErrorResponse(
                "PUBLISH_BLOCKED",
                ex.getMessage(),
                details,
                LocalDateTime.now()
        );

        logger.warn("Publish blocked by {} rule: {}", ex.getConstraintType(), ex.getViolators());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(errorResponse);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        ErrorResponse errorResponse = new ErrorResponse(
                "INTERNAL_ERROR",
                "Unexpected error",
                null,
                LocalDateTime.now()
        );

        logger.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    private HttpStatus statusFor(String errorCode) {
        if (errorCode == null) {
            return HttpStatus.BAD_REQUEST;
        }
        if (BusinessException.PERSISTENCE_ERROR.equals(errorCode)) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        if (errorCode.startsWith("UNKNOWN_")) {
            return HttpStatus.NOT_FOUND;
        }
        if (errorCode.startsWith("DUPLICATE_") || errorCode.startsWith("WEEK_")) {
            return HttpStatus.CONFLICT;
        }
        return HttpStatus.BAD_REQUEST;
    }

    public record ErrorResponse(
            String error,
            String message,
            Map<String, Object> details,
            LocalDateTime timestamp
    ) {}
}
