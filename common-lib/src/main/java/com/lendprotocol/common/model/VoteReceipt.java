package com.lendprotocol.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;

/**
 * Last vote cast by a voter on one proposal. Audit record only; the tally lives on the
 * {@link Proposal} itself. Weight is caller-supplied and not checked against any balance.
 */
public record VoteReceipt(
    @JsonProperty("voter")   Address    voter,
    @JsonProperty("support") boolean    support,
    @JsonProperty("weight")  BigInteger weight
) {}
