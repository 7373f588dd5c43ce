package com.flagship.wealth_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Without an account id every account is synced.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncRequest {

    @JsonProperty("account_id")
    private UUID accountId;
}
