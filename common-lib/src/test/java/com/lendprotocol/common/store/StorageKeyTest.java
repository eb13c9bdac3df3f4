package com.lendprotocol.common.store;

import com.lendprotocol.common.governance.GovernanceKeys;
import com.lendprotocol.common.model.Address;
import com.lendprotocol.common.oracle.OracleKeys;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class StorageKeyTest {

    @Test
    @DisplayName("keys render as namespace:entity[:qualifier]")
    void rendersSegments() {
        assertEquals("gov:counter", GovernanceKeys.counter().render());
        assertEquals("gov:receipts:7", GovernanceKeys.receipts(7).render());
        assertEquals("oracle:sources:XLM", OracleKeys.sources(Address.of("XLM")).render());
        assertEquals("protocol:admin", ProtocolKeys.admin().render());
    }

    @Test
    @DisplayName("every key family renders to a distinct string")
    void familiesDoNotCollide() {
        Address a = Address.of("GABC");
        List<StorageKey> keys = List.of(
            GovernanceKeys.counter(), GovernanceKeys.proposals(), GovernanceKeys.receipts(1),
            GovernanceKeys.receipts(2), GovernanceKeys.quorumBps(), GovernanceKeys.timelock(),
            GovernanceKeys.delegation(a), OracleKeys.sources(a), OracleKeys.heartbeatTtl(),
            OracleKeys.mode(), OracleKeys.perfCount(), ProtocolKeys.admin(), ProtocolKeys.reentrancy());

        Set<String> rendered = new HashSet<>();
        keys.forEach(k -> rendered.add(k.render()));
        assertEquals(keys.size(), rendered.size());
    }

    @Test
    @DisplayName("separator is rejected in namespace and entity")
    void rejectsSeparatorInFixedSegments() {
        assertThrows(IllegalArgumentException.class, () -> StorageKey.of("gov:x", "counter"));
        assertThrows(IllegalArgumentException.class, () -> StorageKey.of("gov", "receipts:1"));
        assertThrows(IllegalArgumentException.class, () -> StorageKey.of(" ", "counter"));
    }

    @Test
    @DisplayName("qualifier may carry the separator since it is always last")
    void qualifierIsLastSegment() {
        StorageKey key = StorageKey.of("oracle", "sources", "a:b");
        assertEquals("oracle:sources:a:b", key.render());
        assertNotEquals(StorageKey.of("oracle", "sources"), key);
    }
}
