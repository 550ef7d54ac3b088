package com.darwinlink.application.client;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Client-side order ids for live placements: ORD + epoch seconds + a
 * 3-digit sequence, so ids stay unique within a second.
 */
public class OrderIdGenerator {

    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    public OrderIdGenerator() {
        this(Clock.systemUTC());
    }

    public OrderIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public String next() {
        long n = sequence.incrementAndGet() % 1000;
        return String.format("ORD%d%03d", clock.instant().getEpochSecond(), n);
    }
}
