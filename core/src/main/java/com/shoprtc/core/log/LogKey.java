package com.shoprtc.core.log;

/**
 * Storage key of one room-log entry: {@code <millis>-<seq>}.
 * <p>
 * The format is a Redis Stream entry id, so the log's natural order is the key order.
 * {@code seq} breaks ties between entries written in the same millisecond.
 * </p>
 *
 * @param millis epoch millis, also the message timestamp
 * @param seq    tie-break within {@code millis}, starting at 0
 */
public record LogKey(long millis, long seq) implements Comparable<LogKey> {

    public LogKey {
        if (millis < 0 || seq < 0) {
            throw new IllegalArgumentException("LogKey parts must be non-negative: " + millis + "-" + seq);
        }
    }

    /**
     * Smallest key at {@code millis}; every entry written at or after {@code millis} is &gt;= it.
     */
    public static LogKey floor(long millis) {
        return new LogKey(millis, 0);
    }

    /**
     * Parses {@code <millis>-<seq>}.
     *
     * @throws IllegalArgumentException if the id is not in that format
     */
    public static LogKey parse(String id) {
        int dash = id == null ? -1 : id.indexOf('-');
        if (dash <= 0 || dash == id.length() - 1) {
            throw new IllegalArgumentException("Not a log key: " + id);
        }
        try {
            return new LogKey(Long.parseLong(id.substring(0, dash)), Long.parseLong(id.substring(dash + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a log key: " + id, e);
        }
    }

    public LogKey next() {
        return new LogKey(millis, seq + 1);
    }

    @Override
    public int compareTo(LogKey other) {
        int byMillis = Long.compare(millis, other.millis);
        return byMillis != 0 ? byMillis : Long.compare(seq, other.seq);
    }

    @Override
    public String toString() {
        return millis + "-" + seq;
    }
}
