package com.walletpnl.api.controller;

import com.walletpnl.api.dto.ErrorBody;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps malformed request input (e.g. a non-numeric limit) to 400 with ErrorBody.
 */
@RestControllerAdvice
public class ValidationExceptionHandler {

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleInput(ServerWebInputException ex) {
        String message = ex.getReason() != null ? ex.getReason() : "Invalid request parameter";
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", message));
    }
}
