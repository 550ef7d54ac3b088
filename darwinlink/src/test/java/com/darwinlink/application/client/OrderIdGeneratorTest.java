package com.darwinlink.application.client;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class OrderIdGeneratorTest {

    @Test
    void testFormat() {
        OrderIdGenerator ids = new OrderIdGenerator(Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC));

        assertEquals("ORD1700000000001", ids.next());
        assertEquals("ORD1700000000002", ids.next());
    }

    @Test
    void testUniqueWithinOneSecond() {
        OrderIdGenerator ids = new OrderIdGenerator(Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC));
        Set<String> seen = new HashSet<>();

        for (int i = 0; i < 999; i++) {
            assertTrue(seen.add(ids.next()), "Duplicate id at " + i);
        }
    }
}
