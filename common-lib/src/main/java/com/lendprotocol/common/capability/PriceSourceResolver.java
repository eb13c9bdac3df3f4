package com.lendprotocol.common.capability;

import com.lendprotocol.common.model.Address;

/**
 * Maps a registered source address to something that can be asked for a price.
 * Unresolvable addresses fail with {@code EXTERNAL_CALL_FAILED}.
 */
@FunctionalInterface
public interface PriceSourceResolver {
    PriceSource resolve(Address source);
}
