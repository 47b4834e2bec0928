package com.shoprtc.socket.redis;

import com.shoprtc.core.log.LogKey;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Interface for Redis operations (Dependency Inversion Principle).
 * <p>
 * Enables testing with in-memory implementations and future Redis client swaps.
 * Every operation is non-blocking; failures are delivered as error signals.
 * </p>
 */
public interface IRedisService {
    /**
     * Appends a serialized message to a room log under an explicit key.
     * Fails if {@code key} is not greater than the newest key in the log.
     */
    Mono<Void> appendRoomMessage(String roomKey, LogKey key, String messageJson);

    /**
     * Reads the newest entries of a room log, newest first.
     */
    Flux<String> getLatestRoomMessages(String roomKey, int count);

    /**
     * Returns the newest key of a room log, or empty if the log is empty.
     */
    Mono<LogKey> getLastRoomKey(String roomKey);

    /**
     * Removes every room-log entry with a key below {@code LogKey.floor(cutoffMillis)}.
     *
     * @return number of entries removed
     */
    Mono<Long> trimRoomMessagesBefore(String roomKey, long cutoffMillis);

    /**
     * Appends a serialized message to the general channel and trims it to {@code cap} entries.
     */
    Mono<Void> appendGeneralMessage(String messageJson, int cap);

    /**
     * Reads the general channel, oldest first, at most {@code cap} entries.
     */
    Mono<List<String>> getGeneralMessages(int cap);

    /**
     * Closes Redis connection.
     */
    void close();
}
