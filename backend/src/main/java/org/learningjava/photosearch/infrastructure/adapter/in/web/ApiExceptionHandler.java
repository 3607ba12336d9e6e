package org.learningjava.photosearch.infrastructure.adapter.in.web;

import org.learningjava.photosearch.domain.error.ImageReadException;
import org.learningjava.photosearch.domain.error.PhotoSearchException;
import org.learningjava.photosearch.domain.error.ProviderException;
import org.learningjava.photosearch.domain.error.QueryValidationException;
import org.learningjava.photosearch.domain.error.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps the photo search exception taxonomy onto HTTP statuses with a {@code {error, message}} body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(QueryValidationException.class)
    public ResponseEntity<Map<String, Object>> validation(QueryValidationException ex) {
        return body(HttpStatus.BAD_REQUEST, "validation_failed", ex);
    }

    @ExceptionHandler(ImageReadException.class)
    public ResponseEntity<Map<String, Object>> imageRead(ImageReadException ex) {
        return body(HttpStatus.UNPROCESSABLE_ENTITY, "image_unreadable", ex);
    }

    @ExceptionHandler(ProviderException.class)
    public ResponseEntity<Map<String, Object>> provider(ProviderException ex) {
        log.warn("Provider failure: {}", ex.getMessage());
        return body(HttpStatus.BAD_GATEWAY, "provider_failed", ex);
    }

    @ExceptionHandler(StoreException.class)
    public ResponseEntity<Map<String, Object>> store(StoreException ex) {
        log.error("Store failure: {}", ex.getMessage());
        return body(HttpStatus.SERVICE_UNAVAILABLE, "store_failed", ex);
    }

    @ExceptionHandler(PhotoSearchException.class)
    public ResponseEntity<Map<String, Object>> other(PhotoSearchException ex) {
        log.error("Unhandled photo search failure", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", ex);
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, Exception ex) {
        String message = ex.getMessage() == null ? ex.toString() : ex.getMessage();
        return ResponseEntity.status(status).body(Map.of("error", error, "message", message));
    }
}
