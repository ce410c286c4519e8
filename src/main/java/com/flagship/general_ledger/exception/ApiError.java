package com.flagship.general_ledger.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Standard API error response.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {
    String error;

    @JsonProperty("error_code")
    String errorCode;

    String message;

    boolean retryable;

    Map<String, String> details;

    @JsonProperty("correlation_id")
    String correlationId;

    Instant timestamp;
}
