package com.lendprotocol.common.capability;

import com.lendprotocol.common.exception.ProtocolException;
import com.lendprotocol.common.model.Address;

/**
 * Authorisation check for privileged mutations.
 */
public interface AdminGate {

    /**
     * @throws ProtocolException with {@code UNAUTHORIZED} when {@code caller} is not the admin
     */
    void requireAdmin(Address caller);
}
