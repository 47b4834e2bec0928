package com.shoprtc.core.log;

import java.time.Clock;

/**
 * Issues strictly increasing {@link LogKey}s for one room.
 * <p>
 * Not thread-safe: a generator belongs to exactly one room actor and is only
 * touched from that actor's mailbox.
 * </p>
 */
public class LogKeyGenerator {
    private final Clock clock;
    private LogKey last;

    public LogKeyGenerator(Clock clock) {
        this.clock = clock;
    }

    /**
     * Raises the floor so the next key is strictly greater than {@code seen}.
     * Used after a restart, when the newest key is read back from storage.
     */
    public void observe(LogKey seen) {
        if (seen != null && (last == null || seen.compareTo(last) > 0)) {
            last = seen;
        }
    }

    /**
     * Returns a key greater than every key issued or observed so far. A clock that steps
     * backwards keeps the previous millisecond and bumps the sequence.
     */
    public LogKey next() {
        long now = clock.millis();
        LogKey key;
        if (last == null || now > last.millis()) {
            key = LogKey.floor(now);
        } else {
            key = last.next();
        }
        last = key;
        return key;
    }

    public LogKey last() {
        return last;
    }
}
