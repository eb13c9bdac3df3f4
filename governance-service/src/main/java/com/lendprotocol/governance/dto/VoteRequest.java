package com.lendprotocol.governance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;

/**
 * Request body for POST /api/v1/governance/proposals/{id}/votes.
 */
public record VoteRequest(
    @JsonProperty("voter")   String     voter,
    @JsonProperty("support") boolean    support,
    @JsonProperty("weight")  BigInteger weight
) {}
