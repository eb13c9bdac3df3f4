package com.lendprotocol.common.capability;

import java.time.Clock;

public class SystemLedgerClock implements LedgerClock {

    private final Clock clock;

    public SystemLedgerClock(Clock clock) {
        this.clock = clock;
    }

    @Override
    public long now() {
        return clock.instant().getEpochSecond();
    }
}
