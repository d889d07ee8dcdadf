package com.z254.campusvoice.voice.api;

import com.z254.campusvoice.voice.domain.exception.ComplaintNotFoundException;
import com.z254.campusvoice.voice.domain.exception.InvalidInputException;
import com.z254.campusvoice.voice.domain.exception.PersistenceUnavailableException;
import com.z254.campusvoice.voice.domain.exception.VoteConflictException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps domain and framework errors onto the API error body:
 * <pre>
 * {
 *   "error_code": "NOT_FOUND",
 *   "message": "...",
 *   "timestamp": "2026-..."
 * }
 * </pre>
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ComplaintNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(ComplaintNotFoundException ex) {
        log.debug("Not found: {}", ex.getMessage());
        return errorResponse("NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(InvalidInputException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidInput(InvalidInputException ex) {
        log.debug("Invalid input: {}", ex.getMessage());
        return errorResponse("INVALID_INPUT", ex.getMessage());
    }

    @ExceptionHandler(VoteConflictException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleVoteConflict(VoteConflictException ex) {
        log.warn("Vote conflict: {}", ex.getMessage());
        return errorResponse("VOTE_CONFLICT", ex.getMessage());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBindErrors(WebExchangeBindException ex) {
        String message = ex.getFieldErrors().stream()
                .map(ApiExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        return errorResponse("INVALID_INPUT", message.isEmpty() ? "request body is invalid" : message);
    }

    @ExceptionHandler({ConstraintViolationException.class, HandlerMethodValidationException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleParameterValidation(Exception ex) {
        return errorResponse("INVALID_INPUT", "request parameters are invalid: " + ex.getMessage());
    }

    @ExceptionHandler(ServerWebInputException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleParseErrors(ServerWebInputException ex) {
        return errorResponse("INVALID_INPUT", "request format is invalid: " + ex.getReason());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.resolve(ex.getStatusCode().value());
        String code = status != null ? status.name() : "ERROR";
        return ResponseEntity.status(ex.getStatusCode())
                .body(errorResponse(code, ex.getReason() != null ? ex.getReason() : code));
    }

    @ExceptionHandler(PersistenceUnavailableException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handlePersistenceUnavailable(PersistenceUnavailableException ex) {
        log.error("Storage unavailable", ex);
        return errorResponse("STORAGE_UNAVAILABLE", "storage is temporarily unavailable, try again");
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return errorResponse("INTERNAL_ERROR", "an unexpected error occurred");
    }

    private static String describe(FieldError error) {
        return error.getField() + " " + error.getDefaultMessage();
    }

    private Map<String, Object> errorResponse(String errorCode, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error_code", errorCode);
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
