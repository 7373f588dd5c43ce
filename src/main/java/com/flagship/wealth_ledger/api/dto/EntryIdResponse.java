package com.flagship.wealth_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.UUID;

@Value
public class EntryIdResponse {

    @JsonProperty("entry_id")
    UUID entryId;
}
