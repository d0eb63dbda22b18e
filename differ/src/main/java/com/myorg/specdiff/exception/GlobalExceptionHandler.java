package com.myorg.specdiff.exception;

import com.fasterxml.jackson.core.JsonProcessingException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.io.FileNotFoundException;
import java.io.IOException;

/**
 * Maps comparison failures to {@link ErrorResponse} bodies. Client mistakes are logged at warn,
 * everything else at error with the stack trace.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String NO_DETAILS = "No additional details";

    // --- Handlers ---
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException ex, HttpServletRequest request) {
        return respond(ex, HttpStatus.BAD_REQUEST, details(ex.getMessage()), request);
    }

    @ExceptionHandler(JsonProcessingException.class)
    public ResponseEntity<ErrorResponse> handleMalformedDocument(JsonProcessingException ex, HttpServletRequest request) {
        return respond(ex, HttpStatus.BAD_REQUEST, "Malformed document: " + details(ex.getOriginalMessage()), request);
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ErrorResponse> handleMissingPart(MissingServletRequestPartException ex, HttpServletRequest request) {
        return respond(ex, HttpStatus.BAD_REQUEST,
                "Both 'old' and 'new' documents are required; missing '" + ex.getRequestPartName() + "'", request);
    }

    @ExceptionHandler(ContractViolationException.class)
    public ResponseEntity<ErrorResponse> handleContractViolation(ContractViolationException ex, HttpServletRequest request) {
        return respond(ex, HttpStatus.UNPROCESSABLE_ENTITY, "Documents cannot be compared: " + details(ex.getMessage()), request);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleMaxSize(MaxUploadSizeExceededException ex, HttpServletRequest request) {
        return respond(ex, HttpStatus.PAYLOAD_TOO_LARGE, "Uploaded document is too large", request);
    }

    @ExceptionHandler(FileNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleFileNotFound(FileNotFoundException ex, HttpServletRequest request) {
        return respond(ex, HttpStatus.NOT_FOUND, "File not found: " + details(ex.getMessage()), request);
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<ErrorResponse> handleIOException(IOException ex, HttpServletRequest request) {
        return respond(ex, HttpStatus.INTERNAL_SERVER_ERROR, "I/O error: " + details(ex.getMessage()), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        return respond(ex, HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected error occurred: " + details(ex.getMessage()), request);
    }

    // --- Helpers ---
    private ResponseEntity<ErrorResponse> respond(Exception ex, HttpStatus status, String message,
                                                  HttpServletRequest request) {
        String uri = request == null || request.getRequestURI() == null ? "unknown" : request.getRequestURI();
        if (status.is4xxClientError()) {
            log.warn("Client error [{}] for {}: {}", status.value(), uri, message);
        } else {
            log.error("Server error [{}] for {}: {}", status.value(), uri, message, ex);
        }
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(ErrorResponse.of(status, message, uri));
    }

    private static String details(String raw) {
        return raw == null || raw.isBlank() ? NO_DETAILS : raw;
    }
}
