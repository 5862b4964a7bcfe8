package com.smartmoneyradar.api.controller;

import com.smartmoneyradar.api.dto.ErrorBody;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps unreadable requests to 400 with ErrorBody.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleInput(ServerWebInputException ex) {
        String message = ex.getReason() != null ? ex.getReason() : "Invalid request";
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", message));
    }
}
