package com.lendprotocol.common.capability;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lendprotocol.common.exception.ProtocolError;
import com.lendprotocol.common.exception.ProtocolException;
import com.lendprotocol.common.store.JsonKvStore;
import com.lendprotocol.common.store.ProtocolKeys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StoredReentrancyGuardTest {

    private JsonKvStore kv;
    private StoredReentrancyGuard guard;

    @BeforeEach
    void setUp() {
        kv    = new JsonKvStore(new ObjectMapper());
        guard = new StoredReentrancyGuard(kv);
    }

    @Test
    @DisplayName("nested guard() fails with REENTRANT_CALL")
    void nestedEntryRejected() {
        ProtocolException e = assertThrows(ProtocolException.class,
            () -> guard.guard(() -> guard.guard(() -> "inner")));
        assertEquals(ProtocolError.REENTRANT_CALL, e.getError());
    }

    @Test
    @DisplayName("flag is cleared after the guarded work, even when it throws")
    void flagClearedOnExit() {
        assertEquals("done", guard.guard(() -> "done"));
        assertFalse(kv.has(ProtocolKeys.reentrancy()));

        assertThrows(IllegalStateException.class, () -> guard.guard(() -> {
            throw new IllegalStateException("fail");
        }));
        assertFalse(kv.has(ProtocolKeys.reentrancy()));
        assertEquals("again", guard.guard(() -> "again"));
    }
}
