package com.flagship.crypto_settlement.api.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Error body returned by every endpoint.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {
    String error;
    String message;
    Map<String, String> details;
    Boolean retryable;
    String suggestedAction;
    Instant timestamp;
}
