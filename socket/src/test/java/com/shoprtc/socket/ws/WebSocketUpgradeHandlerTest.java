package com.shoprtc.socket.ws;

import com.shoprtc.core.model.Identity;
import com.shoprtc.socket.actor.PresenceRegistryActor;
import com.shoprtc.socket.auth.ConnectionIdentityResolver;
import com.shoprtc.socket.log.GeneralChatLog;
import com.shoprtc.socket.metrics.MetricsService;
import com.shoprtc.socket.router.RoomKeyRouter;
import com.shoprtc.socket.support.InMemoryRedisService;
import com.shoprtc.socket.support.MutableClock;
import com.shoprtc.socket.support.TestConfigs;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Upgrade admission for room and presence channels, with a stub verifier that accepts only "good".
 */
class WebSocketUpgradeHandlerTest {
    private static final String UPGRADE = "websocket";

    private RoomKeyRouter router;
    private WebSocketUpgradeHandler handler;

    @BeforeEach
    void setUp() {
        InMemoryRedisService redis = new InMemoryRedisService();
        MutableClock clock = new MutableClock(1_700_000_000_000L);
        MetricsService metricsService = new MetricsService(new SimpleMeterRegistry(), TestConfigs.config());
        PresenceRegistryActor presence = new PresenceRegistryActor(
            new GeneralChatLog(redis, 100), metricsService, clock);
        router = new RoomKeyRouter(TestConfigs.config(), redis, metricsService, presence, clock);
        ConnectionIdentityResolver resolver = new ConnectionIdentityResolver(
            token -> "good".equals(token)
                ? Optional.of(Identity.authenticated("u-1", "Acme", "acme"))
                : Optional.empty()
        );
        handler = new WebSocketUpgradeHandler(TestConfigs.config(), router, resolver, metricsService);
    }

    @Test
    void testRoom_PlainHttpGets426() {
        WebSocketUpgradeHandler.Admission admission =
            handler.admitRoom(null, "chat-acme", Map.of("token", List.of("good")));

        assertFalse(admission.isAccepted());
        assertEquals(426, admission.getStatus());
        assertEquals(WebSocketUpgradeHandler.EXPECTED_UPGRADE, admission.getError());
    }

    @Test
    void testRoom_InvalidRoomGets400() {
        WebSocketUpgradeHandler.Admission general =
            handler.admitRoom(UPGRADE, "general", Map.of("token", List.of("good")));
        WebSocketUpgradeHandler.Admission blank =
            handler.admitRoom(UPGRADE, "", Map.of("token", List.of("good")));

        assertEquals(400, general.getStatus());
        assertEquals(400, blank.getStatus());
    }

    @Test
    void testRoom_MissingOrBadIdentityGets401() {
        WebSocketUpgradeHandler.Admission missing = handler.admitRoom(UPGRADE, "chat-acme", Map.of());
        WebSocketUpgradeHandler.Admission badToken = handler.admitRoom(UPGRADE, "chat-acme",
            Map.of("token", List.of("bad"), "guestId", List.of("guest-1")));

        assertEquals(401, missing.getStatus());
        assertEquals(ConnectionIdentityResolver.MISSING_ROOM_IDENTITY, missing.getError());
        assertEquals(401, badToken.getStatus());
        assertEquals(ConnectionIdentityResolver.INVALID_TOKEN, badToken.getError());
    }

    @Test
    void testRoom_RejectedRequestsCreateNoActor() {
        for (int i = 0; i < 20; i++) {
            handler.admitRoom(UPGRADE, "chat-shop-" + i, Map.of());
            handler.admitRoom(UPGRADE, "chat-shop-" + i, Map.of("token", List.of("forged")));
        }

        assertEquals(0, router.getRoomCount());
    }

    @Test
    void testRoom_GuestAccepted() {
        WebSocketUpgradeHandler.Admission admission = handler.admitRoom(UPGRADE, "chat-acme-guest-9",
            Map.of("guestId", List.of("guest-9"), "guestName", List.of("Visitor")));

        assertTrue(admission.isAccepted());
        assertEquals("chat-acme-guest-9", admission.getRoomKey());
        assertTrue(admission.getIdentity().isGuest());
        // the actor is created by the upgrade, not by admission
        assertEquals(0, router.getRoomCount());
    }

    @Test
    void testPresence_GuestNotAccepted() {
        WebSocketUpgradeHandler.Admission guest =
            handler.admitPresence(UPGRADE, Map.of("guestId", List.of("guest-9")));
        WebSocketUpgradeHandler.Admission member =
            handler.admitPresence("WebSocket", Map.of("token", List.of("good")));

        assertEquals(401, guest.getStatus());
        assertEquals(ConnectionIdentityResolver.MISSING_TOKEN, guest.getError());
        assertTrue(member.isAccepted());
        assertEquals("u-1", member.getIdentity().getUserId());
    }
}
