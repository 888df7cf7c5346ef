package com.baskettecase.dsbroker.api;

import com.baskettecase.dsbroker.credential.CredentialProtectionException;
import com.baskettecase.dsbroker.metadata.NotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Maps broker and registry failures to JSON error responses.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(DataSourceClientException.class)
    public ResponseEntity<ErrorResponse> handleDataSourceClient(DataSourceClientException e) {
        return ResponseEntity.status(e.getStatus())
            .body(new ErrorResponse(e.getStatus().getReasonPhrase(), e.getMessage()));
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(new ErrorResponse("Not Found", e.getMessage()));
    }

    @ExceptionHandler(CredentialProtectionException.class)
    public ResponseEntity<ErrorResponse> handleCredentialProtection(CredentialProtectionException e) {
        log.warn("Rejected credential write: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(new ErrorResponse("Bad Request", e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(new ErrorResponse("Bad Request", message));
    }

    public record ErrorResponse(String error, String message) {}
}
