package com.lendprotocol.common.capability;

import com.lendprotocol.common.model.Address;

import java.math.BigInteger;

/**
 * The {@code get_price(asset)} capability every registered oracle source exposes.
 *
 * <p>Calls are synchronous and untrusted: an implementation may throw, hang until its own
 * timeout, or return a non-positive value meaning "no price".
 */
@FunctionalInterface
public interface PriceSource {
    BigInteger getPrice(Address asset);
}
