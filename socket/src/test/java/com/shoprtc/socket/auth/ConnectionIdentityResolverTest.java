package com.shoprtc.socket.auth;

import com.shoprtc.core.model.Identity;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for ConnectionIdentityResolver with a stub verifier that accepts only "good".
 */
class ConnectionIdentityResolverTest {

    private final ConnectionIdentityResolver resolver = new ConnectionIdentityResolver(
        token -> "good".equals(token)
            ? Optional.of(Identity.authenticated("u-1", "Acme", "acme"))
            : Optional.empty()
    );

    @Test
    void testRoom_TokenAccepted() {
        ConnectionIdentityResolver.Resolution resolution = resolver.forRoom(Map.of("token", List.of("good")));

        assertTrue(resolution.isAccepted());
        assertEquals("u-1", resolution.getIdentity().getUserId());
    }

    @Test
    void testRoom_GuestAccepted_DefaultName() {
        ConnectionIdentityResolver.Resolution resolution = resolver.forRoom(Map.of("guestId", List.of("guest-5")));

        assertTrue(resolution.isAccepted());
        assertTrue(resolution.getIdentity().isGuest());
        assertEquals("guest-5", resolution.getIdentity().getUserId());
        assertEquals("Guest", resolution.getIdentity().getUsername());
    }

    @Test
    void testRoom_GuestName() {
        ConnectionIdentityResolver.Resolution resolution = resolver.forRoom(
            Map.of("guestId", List.of("guest-5"), "guestName", List.of("Visitor")));

        assertEquals("Visitor", resolution.getIdentity().getUsername());
    }

    @Test
    void testRoom_BadTokenRejectedEvenWithGuestParams() {
        ConnectionIdentityResolver.Resolution resolution = resolver.forRoom(
            Map.of("token", List.of("bad"), "guestId", List.of("guest-5")));

        assertFalse(resolution.isAccepted());
        assertEquals(ConnectionIdentityResolver.INVALID_TOKEN, resolution.getError());
    }

    @Test
    void testRoom_NoIdentityRejected() {
        ConnectionIdentityResolver.Resolution resolution = resolver.forRoom(Map.of("guestId", List.of(" ")));

        assertFalse(resolution.isAccepted());
        assertEquals(ConnectionIdentityResolver.MISSING_ROOM_IDENTITY, resolution.getError());
    }

    @Test
    void testPresence_GuestNotAccepted() {
        ConnectionIdentityResolver.Resolution resolution = resolver.forPresence(Map.of("guestId", List.of("guest-5")));

        assertFalse(resolution.isAccepted());
        assertEquals(ConnectionIdentityResolver.MISSING_TOKEN, resolution.getError());
    }

    @Test
    void testPresence_Token() {
        assertTrue(resolver.forPresence(Map.of("token", List.of("good"))).isAccepted());
        assertEquals(ConnectionIdentityResolver.INVALID_TOKEN,
            resolver.forPresence(Map.of("token", List.of("bad"))).getError());
    }
}
