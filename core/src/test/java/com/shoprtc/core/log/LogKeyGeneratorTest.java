package com.shoprtc.core.log;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LogKeyGeneratorTest {

    @Test
    void testSameMillisecond_BumpsSequence() {
        LogKeyGenerator generator = new LogKeyGenerator(Clock.fixed(Instant.ofEpochMilli(1000), ZoneOffset.UTC));

        assertEquals(new LogKey(1000, 0), generator.next());
        assertEquals(new LogKey(1000, 1), generator.next());
        assertEquals(new LogKey(1000, 2), generator.next());
    }

    @Test
    void testNewMillisecond_ResetsSequence() {
        MutableClock clock = new MutableClock(1000);
        LogKeyGenerator generator = new LogKeyGenerator(clock);

        generator.next();
        generator.next();
        clock.millis = 1001;

        assertEquals(new LogKey(1001, 0), generator.next());
    }

    @Test
    void testClockStepsBack_KeysStillIncrease() {
        MutableClock clock = new MutableClock(5000);
        LogKeyGenerator generator = new LogKeyGenerator(clock);

        LogKey first = generator.next();
        clock.millis = 4000;
        LogKey second = generator.next();

        assertTrue(second.compareTo(first) > 0);
        assertEquals(new LogKey(5000, 1), second);
    }

    @Test
    void testObserve_SeedsAfterRestart() {
        LogKeyGenerator generator = new LogKeyGenerator(Clock.fixed(Instant.ofEpochMilli(1000), ZoneOffset.UTC));
        generator.observe(new LogKey(1000, 7));

        assertEquals(new LogKey(1000, 8), generator.next());
    }

    @Test
    void testObserve_OlderKeyIgnored() {
        LogKeyGenerator generator = new LogKeyGenerator(Clock.fixed(Instant.ofEpochMilli(2000), ZoneOffset.UTC));
        generator.next();
        generator.observe(new LogKey(1000, 3));

        assertEquals(new LogKey(2000, 1), generator.next());
    }

    @Test
    void testParseAndFormat() {
        LogKey key = LogKey.parse("1700000000000-3");
        assertEquals(1700000000000L, key.millis());
        assertEquals(3, key.seq());
        assertEquals("1700000000000-3", key.toString());
        assertTrue(LogKey.floor(5).compareTo(new LogKey(4, 99)) > 0);

        assertThrows(IllegalArgumentException.class, () -> LogKey.parse("abc"));
        assertThrows(IllegalArgumentException.class, () -> LogKey.parse("12-"));
        assertThrows(IllegalArgumentException.class, () -> LogKey.parse("x-1"));
    }

    private static class MutableClock extends Clock {
        long millis;

        MutableClock(long millis) {
            this.millis = millis;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis);
        }

        @Override
        public long millis() {
            return millis;
        }
    }
}
