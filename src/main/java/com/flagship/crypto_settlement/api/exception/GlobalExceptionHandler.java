package com.flagship.crypto_settlement.api.exception;

import com.flagship.crypto_settlement.mirror.MirrorNodeException;
import com.flagship.crypto_settlement.settlement.PaymentAttemptRejectedException;
import com.flagship.crypto_settlement.settlement.SettlementInProgressException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps exceptions to {@link ApiError} responses.
 *
 * 400 bad input, 409 invoice state or lock contention, 502 mirror node
 * failure, 500 anything else.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        ApiError error = ApiError.builder()
            .error("Validation Failed")
            .message("Request validation failed")
            .details(errors)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid Request", "Request body is malformed or has invalid values");
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiError> handleMissingParameter(MissingServletRequestParameterException e) {
        log.warn("Missing request parameter: {}", e.getParameterName());
        return build(HttpStatus.BAD_REQUEST, "Invalid Request",
            "Required parameter '" + e.getParameterName() + "' is missing");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage());
    }

    @ExceptionHandler(SettlementInProgressException.class)
    public ResponseEntity<ApiError> handleSettlementInProgress(SettlementInProgressException e) {
        log.info("Settlement in progress elsewhere: invoiceId={}", e.getInvoiceId());

        ApiError error = ApiError.builder()
            .error("Settlement In Progress")
            .message(e.getMessage())
            .retryable(true)
            .suggestedAction("Try again shortly")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(PaymentAttemptRejectedException.class)
    public ResponseEntity<ApiError> handleAttemptRejected(PaymentAttemptRejectedException e) {
        log.warn("Payment attempt rejected: invoiceId={}, reason={}", e.getInvoiceId(), e.getMessage());

        ApiError error = ApiError.builder()
            .error("Payment Not Accepted")
            .message(e.getMessage())
            .retryable(false)
            .suggestedAction(e.getValidation().getSuggestedAction())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiError> handleIllegalState(IllegalStateException e) {
        log.warn("Invalid state: {}", e.getMessage());
        return build(HttpStatus.CONFLICT, "Invalid State", e.getMessage());
    }

    @ExceptionHandler(MirrorNodeException.class)
    public ResponseEntity<ApiError> handleMirrorNode(MirrorNodeException e) {
        log.error("Mirror node failure: {}", e.getMessage());

        ApiError error = ApiError.builder()
            .error("Mirror Node Unavailable")
            .message(e.getMessage())
            .retryable(true)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred");
    }

    private static ResponseEntity<ApiError> build(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(ApiError.builder()
            .error(error)
            .message(message)
            .timestamp(Instant.now())
            .build());
    }
}
