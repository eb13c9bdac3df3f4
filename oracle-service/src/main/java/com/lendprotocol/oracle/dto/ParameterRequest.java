package com.lendprotocol.oracle.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ParameterRequest(
    @JsonProperty("value") long value
) {}
