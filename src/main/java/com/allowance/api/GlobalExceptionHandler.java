package com.allowance.api;

import com.allowance.api.dto.ErrorResponse;
import com.allowance.domain.exception.BlockedException;
import com.allowance.domain.exception.GovernanceException;
import com.allowance.domain.exception.InsufficientFundsException;
import com.allowance.domain.exception.InvalidStateException;
import com.allowance.domain.exception.NotFoundException;
import com.allowance.domain.exception.TransientException;
import com.allowance.domain.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Maps governance exceptions to HTTP responses.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(GovernanceException.class)
    public ResponseEntity<ErrorResponse> handleGovernance(GovernanceException e) {
        HttpStatus status = statusOf(e);
        if (status.is5xxServerError()) {
            log.warn("Request failed with retryable error: {}", e.getMessage());
        } else {
            log.debug("Request rejected ({}): {}", e.getCode(), e.getMessage());
        }
        return ResponseEntity.status(status).body(new ErrorResponse(e.getCode(), e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return ResponseEntity.badRequest().body(new ErrorResponse("VALIDATION_FAILED", message));
    }

    static HttpStatus statusOf(GovernanceException e) {
        if (e instanceof ValidationException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (e instanceof BlockedException || e instanceof InsufficientFundsException) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        if (e instanceof NotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (e instanceof InvalidStateException) {
            return HttpStatus.CONFLICT;
        }
        if (e instanceof TransientException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
