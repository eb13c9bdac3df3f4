package com.lendprotocol.oracle.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for PUT /api/v1/oracle/assets/{asset}/sources.
 */
public record SourceRequest(
    @JsonProperty("address")       String address,
    @JsonProperty("weight")        long   weight,
    @JsonProperty("lastHeartbeat") long   lastHeartbeat
) {}
