package com.lendprotocol.governance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DelegationResponse(
    @JsonProperty("from") String from,
    @JsonProperty("to")   String to
) {}
