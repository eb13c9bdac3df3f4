package com.lendprotocol.common.capability;

import com.lendprotocol.common.exception.ProtocolException;
import com.lendprotocol.common.model.Address;
import com.lendprotocol.common.store.PersistentKv;
import com.lendprotocol.common.store.ProtocolKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * {@link AdminGate} backed by the admin address persisted under {@code protocol:admin}.
 * With no admin stored, every privileged call is rejected.
 */
public class StoredAdminGate implements AdminGate {

    private static final Logger log = LoggerFactory.getLogger(StoredAdminGate.class);

    private final PersistentKv kv;

    public StoredAdminGate(PersistentKv kv) {
        this.kv = kv;
    }

    @Override
    public void requireAdmin(Address caller) {
        Optional<Address> admin = kv.get(ProtocolKeys.admin(), Address.class);
        if (caller == null || admin.isEmpty() || !admin.get().equals(caller)) {
            log.warn("ADMIN_CHECK_FAILED caller={} adminConfigured={}", caller, admin.isPresent());
            throw ProtocolException.unauthorized("caller " + caller + " is not the protocol admin");
        }
    }

    public void setAdmin(Address admin) {
        kv.atomically("set_admin", () -> kv.set(ProtocolKeys.admin(), admin));
        log.info("ADMIN_SET admin={}", admin);
    }

    public Optional<Address> getAdmin() {
        return kv.get(ProtocolKeys.admin(), Address.class);
    }
}
