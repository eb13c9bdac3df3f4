package com.lendprotocol.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Opaque account identity: proposer, voter, admin, asset or price-source contract.
 *
 * <p>Serialised as a bare JSON string so it can be used directly as a request field.
 */
public record Address(@JsonValue String value) {

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public Address {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("address must not be blank");
        }
    }

    public static Address of(String value) {
        return new Address(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
