package com.harvestlink.provenance.exception;

import com.harvestlink.provenance.ledger.exception.LedgerRecordNotFoundException;
import com.harvestlink.provenance.ledger.exception.NoAccountsException;
import com.harvestlink.provenance.ledger.exception.ProviderUnavailableException;
import com.harvestlink.provenance.ledger.exception.TransactionRevertedException;
import com.harvestlink.provenance.ledger.exception.TransactionTimeoutException;
import com.harvestlink.provenance.ledger.exception.UserRejectedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps ledger and request errors to HTTP responses.
 *
 * Verification endpoints never get here: their failures are results.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ProviderUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleProviderUnavailable(ProviderUnavailableException e) {
        log.warn("Ledger provider unavailable: {}", e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Ledger Unavailable", e.getMessage());
    }

    @ExceptionHandler(UserRejectedException.class)
    public ResponseEntity<ErrorResponse> handleUserRejected(UserRejectedException e) {
        log.info("Wallet request rejected: {}", e.getMessage());
        return respond(HttpStatus.FORBIDDEN, "Request Rejected", e.getMessage());
    }

    @ExceptionHandler(NoAccountsException.class)
    public ResponseEntity<ErrorResponse> handleNoAccounts(NoAccountsException e) {
        log.warn("Wallet returned no accounts");
        return respond(HttpStatus.CONFLICT, "No Accounts", e.getMessage());
    }

    @ExceptionHandler(TransactionRevertedException.class)
    public ResponseEntity<ErrorResponse> handleReverted(TransactionRevertedException e) {
        log.warn("Transaction reverted: {}", e.getReason());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(ErrorResponse.builder()
                .error("Transaction Reverted")
                .message(e.getMessage())
                .details(Map.of("reason", e.getReason()))
                .timestamp(Instant.now())
                .build());
    }

    @ExceptionHandler(TransactionTimeoutException.class)
    public ResponseEntity<ErrorResponse> handleTimeout(TransactionTimeoutException e) {
        log.warn("Transaction timed out: {}", e.getMessage());
        return respond(HttpStatus.GATEWAY_TIMEOUT, "Transaction Timeout", e.getMessage());
    }

    @ExceptionHandler(LedgerRecordNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(LedgerRecordNotFoundException e) {
        log.debug("Ledger record not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Not Found", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        ErrorResponse error = ErrorResponse.builder()
            .error("Validation Failed")
            .message("Request validation failed")
            .details(errors)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadParameter(Exception e) {
        log.warn("Bad request parameter: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
        log.warn("Invalid state: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Invalid State", e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred");
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .error(error)
                .message(message)
                .timestamp(Instant.now())
                .build());
    }

    /**
     * Error response DTO.
     */
    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
