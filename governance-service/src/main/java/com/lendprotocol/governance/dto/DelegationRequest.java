package com.lendprotocol.governance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DelegationRequest(
    @JsonProperty("to") String to
) {}
