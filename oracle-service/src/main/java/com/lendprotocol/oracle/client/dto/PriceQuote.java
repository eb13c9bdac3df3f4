package com.lendprotocol.oracle.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;

/**
 * Response body of a price-source endpoint: {@code GET /api/v1/price/{asset}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PriceQuote(
    @JsonProperty("price") BigInteger price
) {}
