package com.shoprtc.socket.session;

import com.shoprtc.core.model.Identity;
import com.shoprtc.socket.config.RtcConfig;
import reactor.core.publisher.Sinks;

import java.util.UUID;

/**
 * Factory for creating Session objects (Single Responsibility Principle).
 * <p>
 * Separated from the actors to isolate session creation logic.
 * </p>
 */
public class SessionFactory {
    private final int perConnBufferSize;

    public SessionFactory(RtcConfig config) {
        this(config.getPerConnBufferSize());
    }

    public SessionFactory(int perConnBufferSize) {
        this.perConnBufferSize = perConnBufferSize;
    }

    /**
     * Creates a new session instance.
     *
     * @param identity identity resolved by the upgrade handler
     * @return Session instance
     */
    public Session createSession(Identity identity) {
        // Bounded outbound buffer; a full buffer fails the emission and drops the session
        Sinks.Many<String> sink = Sinks.many().multicast().onBackpressureBuffer(
            perConnBufferSize, false
        );

        return new Session(UUID.randomUUID().toString(), identity, sink);
    }

}
