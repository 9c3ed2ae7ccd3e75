package com.flagship.classroom_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.UUID;

@Value
public class VoidEntryRequest {

    @NotNull(message = "Actor ID is required")
    @JsonProperty("actor_id")
    UUID actorId;

    @JsonCreator
    public VoidEntryRequest(@JsonProperty("actor_id") UUID actorId) {
        this.actorId = actorId;
    }
}
