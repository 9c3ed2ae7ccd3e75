package com.flagship.classroom_ledger.claim;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class ClaimFailure {

    @JsonProperty("code")
    ClaimFailureCode code;

    @JsonProperty("message")
    String message;

    public static ClaimFailure of(ClaimFailureCode code, String message) {
        return new ClaimFailure(code, message);
    }
}
