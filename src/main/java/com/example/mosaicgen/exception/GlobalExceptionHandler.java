package com.example.mosaicgen.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Единый формат ответов об ошибках.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MosaicException.class)
    public ResponseEntity<Map<String, Object>> handleMosaicException(
            MosaicException ex, WebRequest request) {
        HttpStatus status = statusOf(ex.getErrorCode());
        if (status.is5xxServerError()) {
            log.error("Mosaic error {}: {}", ex.getErrorCode(), ex.getMessage(), ex);
        } else {
            log.warn("Mosaic error {}: {}", ex.getErrorCode(), ex.getMessage());
        }

        ResponseEntity<Map<String, Object>> response = buildErrorResponse(
                status,
                ex.getErrorCode().name(),
                ex.getMessage(),
                request.getDescription(false)
        );
        response.getBody().put("errorCode", ex.getErrorCode().name());
        return response;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(
            MethodArgumentNotValidException ex, WebRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        log.warn("Validation error: {}", message);
        return buildErrorResponse(
                HttpStatus.BAD_REQUEST,
                "Validation Error",
                message,
                request.getDescription(false)
        );
    }

    @ExceptionHandler({
            IllegalArgumentException.class,
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<Map<String, Object>> handleBadRequest(
            Exception ex, WebRequest request) {
        log.warn("Bad request: {}", ex.getMessage());
        return buildErrorResponse(
                HttpStatus.BAD_REQUEST,
                "Bad Request",
                ex.getMessage(),
                request.getDescription(false)
        );
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<Map<String, Object>> handleMissingHeader(
            MissingRequestHeaderException ex, WebRequest request) {
        log.warn("Unauthenticated request: {}", ex.getMessage());
        return buildErrorResponse(
                HttpStatus.UNAUTHORIZED,
                "Unauthorized",
                "Missing " + ex.getHeaderName() + " header",
                request.getDescription(false)
        );
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGlobalException(
            Exception ex, WebRequest request) {
        if (ex instanceof ErrorResponse) {
            HttpStatusCode status = ((ErrorResponse) ex).getStatusCode();
            log.warn("Request failed with {}: {}", status, ex.getMessage());
            return buildErrorResponse(
                    HttpStatus.valueOf(status.value()),
                    HttpStatus.valueOf(status.value()).getReasonPhrase(),
                    ex.getMessage(),
                    request.getDescription(false)
            );
        }

        log.error("Unexpected exception occurred: {}", ex.getMessage(), ex);
        return buildErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "An unexpected error occurred. Please contact support if the problem persists.",
                request.getDescription(false)
        );
    }

    static HttpStatus statusOf(MosaicErrorCode errorCode) {
        switch (errorCode) {
            case ALREADY_IN_PROGRESS:
                return HttpStatus.CONFLICT;
            case JOB_NOT_FOUND:
            case IMAGE_NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case DECODE_ERROR:
            case NO_TILES_AVAILABLE:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private ResponseEntity<Map<String, Object>> buildErrorResponse(
            HttpStatus status,
            String error,
            String message,
            String path) {

        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("timestamp", LocalDateTime.now().toString());
        errorResponse.put("status", status.value());
        errorResponse.put("error", error);
        errorResponse.put("message", message);
        errorResponse.put("path", path.replace("uri=", ""));

        return new ResponseEntity<>(errorResponse, status);
    }
}
