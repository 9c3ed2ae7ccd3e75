package com.flagship.classroom_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.classroom_ledger.ledger.AccountBucket;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class BalanceResponse {

    @JsonProperty("subject_id")
    UUID subjectId;

    @JsonProperty("bucket")
    AccountBucket bucket;

    @JsonProperty("current_balance")
    BigDecimal currentBalance;

    @JsonProperty("available_balance")
    BigDecimal availableBalance;
}
