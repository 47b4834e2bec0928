package com.shoprtc.socket.log;

import com.shoprtc.core.msg.ChatMessage;
import com.shoprtc.core.util.JsonUtils;
import com.shoprtc.socket.redis.IRedisService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Count-capped history of the general channel.
 * <p>
 * The window is loaded from Redis once and then mirrored in memory. A message joins the
 * window only after Redis acknowledged it, and the oldest message is dropped once the cap
 * is exceeded. A failed load leaves the log unloaded so the next reader retries.
 * </p>
 * <p>
 * Owned by the presence actor and only called from its mailbox; not thread-safe.
 * </p>
 */
public class GeneralChatLog {
    private static final Logger log = LoggerFactory.getLogger(GeneralChatLog.class);

    private final IRedisService redisService;
    private final int cap;
    private final Deque<ChatMessage> window = new ArrayDeque<>();
    private boolean loaded;

    public GeneralChatLog(IRedisService redisService, int cap) {
        this.redisService = redisService;
        this.cap = cap;
    }

    /**
     * @return the current window, oldest first; empty if it could not be loaded
     */
    public Mono<List<ChatMessage>> history() {
        return load()
            .then(Mono.fromCallable(() -> (List<ChatMessage>) new ArrayList<>(window)))
            .onErrorResume(err -> {
                log.warn("General channel history unavailable: {}", err.getMessage());
                return Mono.just(List.<ChatMessage>of());
            });
    }

    /**
     * Persists a message, then adds it to the window.
     *
     * @return Mono of the stored message; errors if the write failed
     */
    public Mono<ChatMessage> append(ChatMessage message) {
        String json = JsonUtils.writeValueAsString(message);
        return load()
            .onErrorResume(err -> Mono.empty())
            .then(redisService.appendGeneralMessage(json, cap))
            .then(Mono.fromCallable(() -> {
                window.addLast(message);
                while (window.size() > cap) {
                    window.removeFirst();
                }
                return message;
            }));
    }

    private Mono<Void> load() {
        if (loaded) {
            return Mono.empty();
        }
        return redisService.getGeneralMessages(cap)
            .doOnNext(stored -> {
                window.clear();
                for (String json : stored) {
                    try {
                        window.addLast(JsonUtils.readValue(json, ChatMessage.class));
                    } catch (RuntimeException e) {
                        log.warn("Skipping unreadable general message: {}", e.getMessage());
                    }
                }
                loaded = true;
                log.info("Loaded {} general channel messages", window.size());
            })
            .then();
    }
}
