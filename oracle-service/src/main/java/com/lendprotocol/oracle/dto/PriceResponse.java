package com.lendprotocol.oracle.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;

/**
 * Aggregated price for an asset. {@code price} is null and {@code available} false when
 * no live source produced a positive price.
 */
public record PriceResponse(
    @JsonProperty("asset")     String     asset,
    @JsonProperty("price")     BigInteger price,
    @JsonProperty("available") boolean    available
) {}
