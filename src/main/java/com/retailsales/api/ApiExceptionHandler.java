package com.retailsales.api;

import com.retailsales.domain.ingest.CsvImportException;
import com.retailsales.domain.service.UploadNotFoundException;
import com.retailsales.infrastructure.persistence.StorageAccessException;
import com.retailsales.infrastructure.persistence.StorageFailure;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps domain failures to HTTP responses.
 *
 * 4xx responses are logged as warnings, 5xx as errors.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler({CsvImportException.class, InvalidUploadException.class})
    public ResponseEntity<Map<String, Object>> handleBadUpload(RuntimeException e, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, e, request);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, Object>> handleTooLarge(MaxUploadSizeExceededException e,
                                                              HttpServletRequest request) {
        return respond(HttpStatus.PAYLOAD_TOO_LARGE, e, request);
    }

    @ExceptionHandler(UploadNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(UploadNotFoundException e, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, e, request);
    }

    @ExceptionHandler(StorageAccessException.class)
    public ResponseEntity<Map<String, Object>> handleStorage(StorageAccessException e, HttpServletRequest request) {
        HttpStatus status = e.getFailure() == StorageFailure.FATAL
                ? HttpStatus.INTERNAL_SERVER_ERROR
                : HttpStatus.SERVICE_UNAVAILABLE;
        return respond(status, e, request);
    }

    private ResponseEntity<Map<String, Object>> respond(HttpStatus status, Exception e, HttpServletRequest request) {
        String url = request.getRequestURI();
        if (status.is5xxServerError()) {
            log.error("URL: [{}] - Error response code: [{}] - Error:", url, status.value(), e);
        } else {
            log.warn("URL: [{}] - Error response code: [{}] - {}", url, status.value(), e.getMessage());
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("message", e.getMessage());
        body.put("path", url);
        return ResponseEntity.status(status).body(body);
    }
}
