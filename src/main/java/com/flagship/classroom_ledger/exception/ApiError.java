package com.flagship.classroom_ledger.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Standard API error response.
 *
 * {@code code} and {@code retryable} are set for integrity violations and
 * conflicts so callers can tell a bad request from a lost race.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

    @JsonProperty("error")
    String error;

    @JsonProperty("code")
    String code;

    @JsonProperty("message")
    String message;

    @JsonProperty("retryable")
    Boolean retryable;

    @JsonProperty("details")
    Map<String, String> details;

    @JsonProperty("timestamp")
    Instant timestamp;
}
