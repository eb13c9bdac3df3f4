package com.lendprotocol.governance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for POST /api/v1/governance/proposals.
 */
public record ProposeRequest(
    @JsonProperty("proposer")            String proposer,
    @JsonProperty("title")               String title,
    @JsonProperty("votingPeriodSeconds") long   votingPeriodSeconds
) {}
