package com.shoprtc.socket.log;

import com.shoprtc.core.log.LogKey;
import com.shoprtc.core.log.LogKeyGenerator;
import com.shoprtc.core.msg.ChatMessage;
import com.shoprtc.core.util.JsonUtils;
import com.shoprtc.socket.redis.IRedisService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Append-only message log of one room.
 * <p>
 * Each entry is keyed by a {@link LogKey} whose millisecond part is the message timestamp.
 * Keys come from a per-room {@link LogKeyGenerator}, seeded from the newest stored key the
 * first time the log is written, so ordering survives a restart.
 * </p>
 * <p>
 * Owned by exactly one room actor and only called from its mailbox; not thread-safe.
 * </p>
 */
public class DurableLog {
    private static final Logger log = LoggerFactory.getLogger(DurableLog.class);

    private final String roomKey;
    private final IRedisService redisService;
    private final Clock clock;
    private final LogKeyGenerator keyGenerator;
    private boolean seeded;

    public DurableLog(String roomKey, IRedisService redisService, Clock clock) {
        this.roomKey = roomKey;
        this.redisService = redisService;
        this.clock = clock;
        this.keyGenerator = new LogKeyGenerator(clock);
    }

    /**
     * Allocates the next key, builds the message for it and persists it.
     *
     * @param factory builds the message for the allocated key
     * @return Mono of the stored message; errors if the write failed
     */
    public Mono<ChatMessage> append(Function<LogKey, ChatMessage> factory) {
        return seed().then(Mono.defer(() -> {
            LogKey key = keyGenerator.next();
            ChatMessage message = factory.apply(key);
            String json = JsonUtils.writeValueAsString(message);
            return redisService.appendRoomMessage(roomKey, key, json).thenReturn(message);
        }));
    }

    /**
     * Reads the newest {@code limit} messages still inside the retention window. Entries the
     * sweep has not removed yet are skipped.
     *
     * @return messages in chronological order
     */
    public Mono<List<ChatMessage>> latest(int limit, Duration retention) {
        return redisService.getLatestRoomMessages(roomKey, limit)
            .flatMap(this::decode)
            .filter(message -> message.getTimestamp() >= cutoff(retention))
            .collectList()
            .map(newestFirst -> {
                List<ChatMessage> chronological = new ArrayList<>(newestFirst);
                Collections.reverse(chronological);
                return chronological;
            });
    }

    /**
     * Deletes every message older than {@code retention}.
     *
     * @return number of removed messages
     */
    public Mono<Long> sweep(Duration retention) {
        return redisService.trimRoomMessagesBefore(roomKey, cutoff(retention))
            .defaultIfEmpty(0L);
    }

    private long cutoff(Duration retention) {
        return Math.max(0, clock.millis() - retention.toMillis());
    }

    private Mono<Void> seed() {
        if (seeded) {
            return Mono.empty();
        }
        return redisService.getLastRoomKey(roomKey)
            .doOnNext(keyGenerator::observe)
            .then(Mono.fromRunnable(() -> seeded = true));
    }

    private Flux<ChatMessage> decode(String json) {
        try {
            return Flux.just(JsonUtils.readValue(json, ChatMessage.class));
        } catch (RuntimeException e) {
            log.warn("Skipping unreadable entry in room {}: {}", roomKey, e.getMessage());
            return Flux.empty();
        }
    }

    public String getRoomKey() {
        return roomKey;
    }
}
