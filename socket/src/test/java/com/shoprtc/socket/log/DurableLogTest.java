package com.shoprtc.socket.log;

import com.shoprtc.core.log.LogKey;
import com.shoprtc.core.msg.ChatMessage;
import com.shoprtc.core.msg.MessageType;
import com.shoprtc.core.util.JsonUtils;
import com.shoprtc.socket.support.InMemoryRedisService;
import com.shoprtc.socket.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DurableLogTest {
    private static final long NOW = 1_700_000_000_000L;
    private static final Duration RETENTION = Duration.ofDays(14);

    private InMemoryRedisService redis;
    private MutableClock clock;
    private DurableLog durableLog;

    @BeforeEach
    void setUp() {
        redis = new InMemoryRedisService();
        clock = new MutableClock(NOW);
        durableLog = new DurableLog("chat-acme", redis, clock);
    }

    private static ChatMessage message(LogKey key, String content) {
        return ChatMessage.builder()
            .id("id-" + key)
            .senderId("u-1")
            .senderName("Acme")
            .content(content)
            .timestamp(key.millis())
            .type(MessageType.TEXT)
            .build();
    }

    @Test
    void testAppend_TimestampIsKeyMillis() {
        StepVerifier.create(durableLog.append(key -> message(key, "hello")))
            .assertNext(stored -> {
                assertEquals(NOW, stored.getTimestamp());
                assertEquals("id-" + NOW + "-0", stored.getId());
            })
            .verifyComplete();

        assertEquals(new LogKey(NOW, 0), redis.roomLog("chat-acme").firstKey());
    }

    @Test
    void testLatest_ChronologicalAndLimited() {
        for (int i = 0; i < 5; i++) {
            String content = "m" + i;
            clock.advance(1);
            durableLog.append(key -> message(key, content)).block();
        }

        List<ChatMessage> latest = durableLog.latest(3, RETENTION).block();

        assertEquals(List.of("m2", "m3", "m4"), latest.stream().map(ChatMessage::getContent).toList());
    }

    @Test
    void testLatest_UnreadableEntrySkipped() {
        redis.appendRoomMessage("chat-acme", new LogKey(NOW - 10, 0), "{broken").block();
        durableLog.append(key -> message(key, "ok")).block();

        List<ChatMessage> latest = durableLog.latest(10, RETENTION).block();

        assertEquals(1, latest.size());
        assertEquals("ok", latest.get(0).getContent());
    }

    @Test
    void testLatest_ExpiredEntriesNotReturned() {
        LogKey stale = new LogKey(NOW - Duration.ofDays(20).toMillis(), 0);
        redis.appendRoomMessage("chat-acme", stale, JsonUtils.writeValueAsString(message(stale, "stale"))).block();
        durableLog.append(key -> message(key, "fresh")).block();

        List<ChatMessage> latest = durableLog.latest(10, RETENTION).block();

        assertEquals(List.of("fresh"), latest.stream().map(ChatMessage::getContent).toList());
    }

    @Test
    void testSweep_RemovesOnlyExpired() {
        redis.appendRoomMessage("chat-acme", new LogKey(NOW - Duration.ofDays(3).toMillis(), 0), "{}").block();
        redis.appendRoomMessage("chat-acme", new LogKey(NOW - Duration.ofHours(1).toMillis(), 0), "{}").block();

        StepVerifier.create(durableLog.sweep(Duration.ofDays(1)))
            .expectNext(1L)
            .verifyComplete();

        assertEquals(1, redis.roomLog("chat-acme").size());
    }

    @Test
    void testAppendFailure_Propagated() {
        redis.failAppends = true;

        StepVerifier.create(durableLog.append(key -> message(key, "lost")))
            .expectError(IllegalStateException.class)
            .verify();
    }
}
