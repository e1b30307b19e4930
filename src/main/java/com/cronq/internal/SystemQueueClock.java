package com.cronq.internal;

import com.cronq.QueueClock;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

public class SystemQueueClock implements QueueClock {

    private final Clock clock;

    public SystemQueueClock() {
        this(Clock.systemUTC());
    }

    public SystemQueueClock(Clock clock) {
        this.clock = clock;
    }

    @Override
    public OffsetDateTime now() {
        return OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);
    }
}
