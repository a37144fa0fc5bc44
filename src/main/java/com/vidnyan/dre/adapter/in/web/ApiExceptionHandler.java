package com.vidnyan.dre.adapter.in.web;

import com.vidnyan.dre.domain.error.DynamicRequestException;
import com.vidnyan.dre.domain.error.IntegrationNotFoundException;
import com.vidnyan.dre.domain.error.RequestNotFoundException;
import com.vidnyan.dre.domain.error.ResultsNotAvailableException;
import com.vidnyan.dre.domain.error.SpawnDepthExceededException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

/**
 * Maps engine exceptions to {@code {error, detail, timestamp}} bodies.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler({RequestNotFoundException.class, IntegrationNotFoundException.class,
            ResultsNotAvailableException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(DynamicRequestException ex) {
        return respond(HttpStatus.NOT_FOUND, "not_found", ex.getMessage());
    }

    @ExceptionHandler(SpawnDepthExceededException.class)
    public ResponseEntity<ErrorResponse> handleSpawnDepth(SpawnDepthExceededException ex) {
        log.warn("Rejected request at spawn depth {} (max {})", ex.getSpawnDepth(), ex.getMaxSpawnDepth());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "spawn_depth_exceeded", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadInput(IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, "invalid_request", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        return respond(HttpStatus.BAD_REQUEST, "invalid_request", ex.getMostSpecificCause().getMessage());
    }

    @ExceptionHandler(DynamicRequestException.class)
    public ResponseEntity<ErrorResponse> handleEngineFailure(DynamicRequestException ex) {
        log.error("Request handling failed: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "engine_error", ex.getMessage());
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String detail) {
        return ResponseEntity.status(status).body(new ErrorResponse(error, detail, Instant.now()));
    }

    public record ErrorResponse(String error, String detail, Instant timestamp) {}
}
