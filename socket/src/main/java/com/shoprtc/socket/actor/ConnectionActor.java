package com.shoprtc.socket.actor;

import com.shoprtc.socket.session.Session;
import reactor.core.publisher.Mono;

/**
 * An actor that accepts WebSocket sessions.
 * <p>
 * Implementations run every operation through their own {@link Mailbox}; the returned
 * {@code Mono} completes once the operation has been applied.
 * </p>
 */
public interface ConnectionActor {
    /**
     * Accepts a new session, sends it its initial events and registers it for broadcasts.
     */
    Mono<Void> connect(Session session);

    /**
     * Handles one raw frame from a registered session.
     */
    Mono<Void> receive(Session session, String rawPayload);

    /**
     * Deregisters a session. Idempotent.
     */
    Mono<Void> disconnect(Session session);

    /**
     * Closes every registered session (graceful shutdown).
     */
    Mono<Void> closeAll();
}
