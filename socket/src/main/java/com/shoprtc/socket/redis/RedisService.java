package com.shoprtc.socket.redis;

import com.shoprtc.core.log.LogKey;
import com.shoprtc.core.redis.Keys;
import com.shoprtc.socket.config.RtcConfig;
import io.lettuce.core.Limit;
import io.lettuce.core.Range;
import io.lettuce.core.RedisClient;
import io.lettuce.core.StreamMessage;
import io.lettuce.core.XAddArgs;
import io.lettuce.core.XTrimArgs;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Reactive Redis service backing room logs and the general channel.
 * <p>
 * All operations are non-blocking using Lettuce reactive API.
 * Implements IRedisService for dependency inversion.
 * </p>
 */
public class RedisService implements IRedisService {
    private static final Logger log = LoggerFactory.getLogger(RedisService.class);

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;
    private final RedisReactiveCommands<String, String> commands;

    public RedisService(RtcConfig config) {
        this.client = RedisClient.create(config.getRedisUrl());
        this.connection = client.connect();
        this.commands = connection.reactive();
        log.info("Connected to Redis: {}", config.getRedisUrl());
    }

    /**
     * Appends a message to a room log using Redis Streams (XADD with an explicit id).
     * <p>
     * The caller supplies the id so that the message timestamp and its storage key agree.
     * Redis rejects ids that are not greater than the stream's last id, which surfaces
     * here as an error signal.
     * </p>
     *
     * @param roomKey     Room key
     * @param key         Entry id
     * @param messageJson Serialized message (JSON)
     * @return Mono completing when appended
     */
    @Override
    public Mono<Void> appendRoomMessage(String roomKey, LogKey key, String messageJson) {
        return commands.xadd(Keys.roomLog(roomKey), appendArgs(key), Map.of(Keys.MESSAGE_FIELD, messageJson))
            .then()
            .doOnSuccess(v -> log.debug("Appended {} to room {}", key, roomKey))
            .doOnError(err -> log.error("Failed to append {} to room {}", key, roomKey, err));
    }

    /**
     * Reads the newest entries of a room log with XREVRANGE.
     *
     * @param roomKey Room key
     * @param count   Maximum number of entries
     * @return Flux of messages, newest first
     */
    @Override
    public Flux<String> getLatestRoomMessages(String roomKey, int count) {
        return commands.xrevrange(Keys.roomLog(roomKey), Range.unbounded(), Limit.from(count))
            .mapNotNull(message -> message.getBody().get(Keys.MESSAGE_FIELD))
            .doOnError(err -> log.error("Failed to read history of room {}", roomKey, err));
    }

    @Override
    public Mono<LogKey> getLastRoomKey(String roomKey) {
        return commands.xrevrange(Keys.roomLog(roomKey), Range.unbounded(), Limit.from(1))
            .next()
            .map(StreamMessage::getId)
            .map(LogKey::parse)
            .doOnError(err -> log.error("Failed to read last key of room {}", roomKey, err));
    }

    /**
     * Removes entries older than the cutoff with an exact XTRIM MINID.
     *
     * @param roomKey      Room key
     * @param cutoffMillis Entries with a smaller millisecond part are removed
     * @return Mono of the number of removed entries
     */
    @Override
    public Mono<Long> trimRoomMessagesBefore(String roomKey, long cutoffMillis) {
        return commands.xtrim(Keys.roomLog(roomKey), trimArgs(cutoffMillis))
            .doOnSuccess(removed -> {
                if (removed != null && removed > 0) {
                    log.info("Swept {} expired messages from room {}", removed, roomKey);
                }
            })
            .doOnError(err -> log.error("Failed to sweep room {}", roomKey, err));
    }

    /**
     * Pushes a message to the general channel and trims it to the newest {@code cap} entries.
     */
    @Override
    public Mono<Void> appendGeneralMessage(String messageJson, int cap) {
        String key = Keys.generalMessages();

        return commands.rpush(key, messageJson)
            .then(commands.ltrim(key, -cap, -1))
            .then()
            .doOnError(err -> log.error("Failed to append to general channel", err));
    }

    @Override
    public Mono<List<String>> getGeneralMessages(int cap) {
        return commands.lrange(Keys.generalMessages(), -cap, -1)
            .collectList()
            .doOnError(err -> log.error("Failed to read general channel", err));
    }

    static XAddArgs appendArgs(LogKey key) {
        return new XAddArgs().id(key.toString());
    }

    static XTrimArgs trimArgs(long cutoffMillis) {
        return new XTrimArgs().minId(LogKey.floor(cutoffMillis).toString());
    }

    @Override
    public void close() {
        connection.close();
        client.shutdown();
        log.info("Redis connection closed");
    }
}
