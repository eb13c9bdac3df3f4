package com.lendprotocol.governance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for the admin-gated PUT /params/* endpoints.
 */
public record ParameterRequest(
    @JsonProperty("value") long value
) {}
