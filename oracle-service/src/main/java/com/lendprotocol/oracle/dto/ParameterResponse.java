package com.lendprotocol.oracle.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ParameterResponse(
    @JsonProperty("name")  String name,
    @JsonProperty("value") long   value
) {}
